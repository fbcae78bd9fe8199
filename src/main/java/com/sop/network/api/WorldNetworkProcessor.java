package com.sop.network.api;

import com.sop.network.build.GraphBuilder;
import com.sop.network.cache.CacheConfig;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.export.NetworkJsonExporter;
import com.sop.network.logging.LogContext;
import com.sop.network.metrics.MetricsService;
import com.sop.network.metrics.NoOpMetricsService;
import com.sop.network.observation.ObservationNetwork;
import com.sop.network.parse.ParserConfig;
import com.sop.network.parse.StructuralParser;
import com.sop.network.parse.StructuralRecord;
import com.sop.network.query.NetworkQueryService;
import com.sop.network.resolve.CachingDocumentLocator;
import com.sop.network.resolve.DeepLinkResolver;
import com.sop.network.resolve.DocumentLocator;
import com.sop.network.resolve.ResolutionSummary;
import com.sop.network.resolve.ResolverOptions;
import com.sop.network.tracing.NoOpTracingService;
import com.sop.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Entry point that turns procedure text into a resolved {@link WorldNetwork}.
 *
 * <p>Each call parses the text, builds the network, resolves its references
 * when a locator is configured, and feeds the entities into a shared
 * {@link ObservationNetwork}.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * WorldNetworkProcessor processor = WorldNetworkProcessor.builder()
 *     .locator(new DirectoryDocumentLocator(List.of(Path.of("sops"))))
 *     .options(ResolverOptions.withMaxDepth(2))
 *     .build();
 *
 * ProcessingResult result = processor.process(text, "PR.OP.CL.1000");
 * NetworkQueryService queries = processor.query(result.network());
 * </pre>
 *
 * <p>Instances are not thread-safe; the observation network is mutated by
 * every call.</p>
 */
public class WorldNetworkProcessor {
    private static final Logger log = LoggerFactory.getLogger(WorldNetworkProcessor.class);

    private final StructuralParser parser;
    private final GraphBuilder graphBuilder;
    private final DeepLinkResolver resolver;
    private final ResolverOptions options;
    private final MetricsService metricsService;
    private final NetworkJsonExporter exporter;
    private final ObservationNetwork observations = new ObservationNetwork();

    private WorldNetworkProcessor(Builder builder) {
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.parser = new StructuralParser(builder.parserConfig != null ? builder.parserConfig : ParserConfig.defaults());
        this.graphBuilder = new GraphBuilder(tracingService);
        this.options = builder.options != null ? builder.options : ResolverOptions.defaults();
        this.exporter = builder.exporter != null ? builder.exporter : new NetworkJsonExporter();

        DocumentLocator locator = builder.locator;
        if (locator != null && builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            locator = new CachingDocumentLocator(locator, builder.cacheConfig, metricsService);
        }
        this.resolver = locator == null ? null : DeepLinkResolver.builder()
                .locator(locator)
                .parser(parser)
                .graphBuilder(graphBuilder)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build();
    }

    /**
     * Processes a document named after its title, or its key when it has none.
     */
    public ProcessingResult process(String rawText, String documentKey) {
        return process(rawText, documentKey, null);
    }

    public ProcessingResult process(String rawText, String documentKey, String documentName) {
        Objects.requireNonNull(rawText, "rawText is required");
        Objects.requireNonNull(documentKey, "documentKey is required");

        try (LogContext ctx = LogContext.forDocument(documentKey)) {
            long start = System.nanoTime();
            StructuralRecord record = parser.parse(rawText);
            metricsService.recordParseDuration(Duration.ofNanos(System.nanoTime() - start));

            WorldNetwork network = graphBuilder.build(record, documentKey, documentName);
            ResolutionSummary summary = null;
            if (resolver != null) {
                summary = resolver.resolveWithSummary(network, options);
            }
            observations.absorb(network);

            ProcessingResult result = new ProcessingResult(record, network, summary,
                    new NetworkQueryService(network).statistics());
            log.info("document.processed key={} nodes={} edges={} references={} resolved={}",
                    documentKey, network.nodeCount(), network.edgeCount(), network.getReferences().size(),
                    network.getLinkedProcedures().size());
            return result;
        }
    }

    /**
     * Reads a UTF-8 file and processes it under its base name.
     */
    public ProcessingResult processFile(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String key = dot > 0 ? name.substring(0, dot) : name;
        return process(text, key, name);
    }

    public NetworkQueryService query(WorldNetwork network) {
        return new NetworkQueryService(network);
    }

    public String toJson(WorldNetwork network) {
        return exporter.toJson(network);
    }

    public void export(WorldNetwork network, Path target) {
        exporter.write(network, target);
    }

    public ObservationNetwork getObservations() {
        return observations;
    }

    public boolean isResolving() {
        return resolver != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ParserConfig parserConfig;
        private DocumentLocator locator;
        private CacheConfig cacheConfig;
        private ResolverOptions options;
        private MetricsService metricsService;
        private TracingService tracingService;
        private NetworkJsonExporter exporter;

        public Builder parserConfig(ParserConfig parserConfig) {
            this.parserConfig = parserConfig;
            return this;
        }

        /**
         * Locator for referenced documents. Without one, references stay pending.
         */
        public Builder locator(DocumentLocator locator) {
            this.locator = locator;
            return this;
        }

        /**
         * Caches locator lookups when enabled. Not cached by default.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder exporter(NetworkJsonExporter exporter) {
            this.exporter = exporter;
            return this;
        }

        public WorldNetworkProcessor build() {
            return new WorldNetworkProcessor(this);
        }
    }
}

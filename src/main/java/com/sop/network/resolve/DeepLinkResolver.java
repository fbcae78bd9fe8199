package com.sop.network.resolve;

import com.sop.network.build.GraphBuilder;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.ReferenceStatus;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.logging.LogContext;
import com.sop.network.metrics.MetricsService;
import com.sop.network.metrics.NoOpMetricsService;
import com.sop.network.parse.StructuralParser;
import com.sop.network.parse.StructuralRecord;
import com.sop.network.tracing.NoOpTracingService;
import com.sop.network.tracing.Span;
import com.sop.network.tracing.SpanAttributes;
import com.sop.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves the pending procedure references of a network by locating, parsing,
 * building and merging the referenced documents, level by level.
 *
 * <p>References are processed in order of discovery depth, so every code is
 * handled at the smallest number of hops it can be reached in. A reference is
 * marked {@code resolving} when its fetch starts, and a code is registered only
 * once per network, so documents that reference each other are each merged at
 * most once. Once the timeout has elapsed no further fetch starts. Fetching, parsing and building may run on a
 * worker pool; merges always run on the calling thread in code order, which
 * keeps id allocation single-writer and the result deterministic.</p>
 *
 * <p>Failures never escape: a missing document marks its reference
 * {@code not_found}, any other failure marks it {@code error}, and the pass
 * moves on.</p>
 */
public class DeepLinkResolver {
    private static final Logger log = LoggerFactory.getLogger(DeepLinkResolver.class);

    private final DocumentLocator locator;
    private final StructuralParser parser;
    private final GraphBuilder graphBuilder;
    private final GraphMerger merger;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private DeepLinkResolver(Builder builder) {
        this.locator = builder.locator;
        this.parser = builder.parser != null ? builder.parser : new StructuralParser();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.graphBuilder = builder.graphBuilder != null ? builder.graphBuilder : new GraphBuilder(tracingService);
        this.merger = builder.merger != null ? builder.merger : new GraphMerger();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    public WorldNetwork resolveAll(WorldNetwork network, int maxDepth) {
        return resolveAll(network, ResolverOptions.withMaxDepth(maxDepth));
    }

    /**
     * Resolves pending references in place.
     *
     * @return the same network
     */
    public WorldNetwork resolveAll(WorldNetwork network, ResolverOptions options) {
        resolveWithSummary(network, options);
        return network;
    }

    public ResolutionSummary resolveWithSummary(WorldNetwork network, ResolverOptions options) {
        Objects.requireNonNull(network, "network is required");
        Objects.requireNonNull(options, "options is required");

        long startNanos = System.nanoTime();
        Duration timeout = options.getTimeout();
        Tally tally = new Tally();

        try (LogContext ctx = LogContext.forResolution(LogContext.newPassId(), network.getDocumentId());
             Span span = tracingService.startResolution(network.getDocumentId())) {
            span.setAttribute(SpanAttributes.MAX_DEPTH, options.getMaxDepth());
            if (options.isRetryFailed()) {
                reopenFailed(network);
            }
            log.info("resolution.starting pending={} options={}",
                    network.getReferences(ReferenceStatus.PENDING).size(), options);

            Deadline deadline = new Deadline(startNanos, timeout);
            ExecutorService executor = options.getMaxConcurrency() > 1
                    ? Executors.newFixedThreadPool(options.getMaxConcurrency()) : null;
            try {
                List<ProcedureReference> level;
                while (!(level = nextLevel(network, options.getMaxDepth())).isEmpty()) {
                    if (deadline.expired() || !resolveLevel(network, level, executor, deadline, tally)) {
                        tally.skippedByTimeout = countEligible(network, options.getMaxDepth());
                        log.warn("resolution.timeout skipped={}", tally.skippedByTimeout);
                        break;
                    }
                }
            } finally {
                if (executor != null) {
                    executor.shutdownNow();
                }
            }

            tally.depthLimited = network.getReferences(ReferenceStatus.PENDING).size() - tally.skippedByTimeout;
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metricsService.recordResolutionDuration(elapsed);
            span.setAttribute(SpanAttributes.REFERENCES_RESOLVED, tally.resolved);
            span.setAttribute(SpanAttributes.REFERENCES_SKIPPED, tally.skippedByTimeout);
            span.succeed();

            ResolutionSummary summary = new ResolutionSummary(tally.attempted, tally.resolved, tally.notFound,
                    tally.errors, tally.depthLimited, tally.skippedByTimeout, elapsed);
            log.info("resolution.completed attempted={} resolved={} notFound={} errors={} depthLimited={} elapsedMs={}",
                    summary.attempted(), summary.resolved(), summary.notFound(), summary.errors(),
                    summary.depthLimited(), elapsed.toMillis());
            return summary;
        }
    }

    private void reopenFailed(WorldNetwork network) {
        for (ProcedureReference reference : network.getReferences()) {
            ReferenceStatus status = reference.getStatus();
            if (status == ReferenceStatus.NOT_FOUND || status == ReferenceStatus.ERROR) {
                reference.reopen();
                log.debug("reference.reopened code={} previous={}", reference.getCode(), status);
            }
        }
    }

    /**
     * Pending references at the smallest depth below the limit, in registration order.
     */
    static List<ProcedureReference> nextLevel(WorldNetwork network, int maxDepth) {
        List<ProcedureReference> eligible = network.getReferences(ReferenceStatus.PENDING).stream()
                .filter(r -> r.getDepth() < maxDepth)
                .toList();
        if (eligible.isEmpty()) {
            return List.of();
        }
        int depth = eligible.stream().mapToInt(ProcedureReference::getDepth).min().orElseThrow();
        return eligible.stream().filter(r -> r.getDepth() == depth).toList();
    }

    private static int countEligible(WorldNetwork network, int maxDepth) {
        return (int) network.getReferences(ReferenceStatus.PENDING).stream()
                .filter(r -> r.getDepth() < maxDepth)
                .count();
    }

    /**
     * Resolves one level. A reference is marked {@code resolving} only when its
     * fetch starts; references reached after the deadline stay {@code pending}.
     *
     * @return false when the deadline cut the level short
     */
    private boolean resolveLevel(WorldNetwork network, List<ProcedureReference> level, ExecutorService executor,
                                 Deadline deadline, Tally tally) {
        log.debug("resolution.level depth={} references={}", level.get(0).getDepth(), level.size());

        List<ProcedureReference> toFetch = new ArrayList<>();
        for (ProcedureReference reference : level) {
            if (isSelfReference(network, reference.getCode())) {
                reference.markResolving();
                linkToOwnRoot(network, reference);
                tally.resolved++;
            } else {
                toFetch.add(reference);
            }
        }

        List<Fetched> fetched = fetchAll(toFetch, executor, deadline);
        boolean complete = true;
        for (int i = 0; i < toFetch.size(); i++) {
            Fetched result = fetched.get(i);
            if (result.outcome() == Outcome.SKIPPED) {
                complete = false;
                continue;
            }
            tally.attempted++;
            apply(network, toFetch.get(i), result, tally);
        }
        return complete;
    }

    private boolean isSelfReference(WorldNetwork network, String code) {
        Object documentNumber = network.getMetadata().get("document_number");
        return code.equalsIgnoreCase(network.getDocumentId())
                || (documentNumber != null && code.equalsIgnoreCase(documentNumber.toString()));
    }

    private void linkToOwnRoot(WorldNetwork network, ProcedureReference reference) {
        String rootId = network.getRootId();
        network.linkProcedure(reference.getCode(), rootId);
        for (Node pointer : network.findReferenceNodes(reference.getCode())) {
            network.addEdge(pointer.getId(), rootId, EdgeKind.DEEP_LINK);
        }
        reference.markResolved(rootId);
        metricsService.incrementReferenceOutcome(ReferenceStatus.RESOLVED);
        log.info("reference.resolved code={} depth={} linkedRootId={} self=true",
                reference.getCode(), reference.getDepth(), rootId);
    }

    private List<Fetched> fetchAll(List<ProcedureReference> references, ExecutorService executor, Deadline deadline) {
        if (executor == null) {
            List<Fetched> results = new ArrayList<>();
            for (ProcedureReference reference : references) {
                results.add(start(reference, deadline));
            }
            return results;
        }
        List<Future<Fetched>> futures = references.stream()
                .map(r -> executor.submit(() -> start(r, deadline)))
                .toList();
        List<Fetched> results = new ArrayList<>();
        for (Future<Fetched> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(Fetched.failed("interrupted"));
            } catch (ExecutionException e) {
                results.add(Fetched.failed(messageOf(e.getCause())));
            }
        }
        return results;
    }

    /**
     * Starts the fetch of one reference unless the deadline has passed. On a
     * worker thread the status change is published to the caller by {@link Future#get()}.
     */
    private Fetched start(ProcedureReference reference, Deadline deadline) {
        if (deadline.expired()) {
            return Fetched.skipped();
        }
        reference.markResolving();
        return fetch(reference.getCode(), reference.getDepth());
    }

    /**
     * Locates, parses and builds one referenced document. Touches no shared state.
     */
    private Fetched fetch(String code, int depth) {
        try (Span span = tracingService.startReference(code)) {
            span.setAttribute(SpanAttributes.REFERENCE_DEPTH, depth);
            try {
                LocatorResult located = locator.locate(code);
                if (located == null || !located.found()) {
                    span.setAttribute(SpanAttributes.REFERENCE_OUTCOME, ReferenceStatus.NOT_FOUND.getTag());
                    span.succeed();
                    return Fetched.notFound();
                }
                long start = System.nanoTime();
                StructuralRecord record = parser.parse(located.rawText());
                WorldNetwork document = graphBuilder.build(record, code, located.documentName());
                metricsService.recordParseDuration(Duration.ofNanos(System.nanoTime() - start));
                span.setAttribute(SpanAttributes.NETWORK_NODES, document.nodeCount());
                span.succeed();
                return Fetched.found(document);
            } catch (IOException | RuntimeException e) {
                span.setAttribute(SpanAttributes.REFERENCE_OUTCOME, ReferenceStatus.ERROR.getTag());
                span.fail(e);
                log.warn("reference.fetchFailed code={} error={}", code, messageOf(e));
                return Fetched.failed(messageOf(e));
            }
        }
    }

    private void apply(WorldNetwork network, ProcedureReference reference, Fetched fetched, Tally tally) {
        String code = reference.getCode();
        if (reference.isPending()) {
            // interrupted before its task ran
            reference.markResolving();
        }
        switch (fetched.outcome()) {
            case FOUND -> {
                try {
                    MergeResult result = merger.mergeInto(network, fetched.document(), code, reference.getDepth());
                    reference.markResolved(result.linkedRootId());
                    metricsService.recordMergedNodes(result.nodesCopied());
                    tally.resolved++;
                    log.info("reference.resolved code={} depth={} linkedRootId={} newReferences={}",
                            code, reference.getDepth(), result.linkedRootId(), result.newReferences().size());
                } catch (RuntimeException e) {
                    log.warn("reference.mergeFailed code={} error={}", code, messageOf(e));
                    reference.markError(messageOf(e));
                    tally.errors++;
                }
            }
            case NOT_FOUND -> {
                reference.markNotFound();
                tally.notFound++;
                log.info("reference.notFound code={} depth={}", code, reference.getDepth());
            }
            case FAILED -> {
                reference.markError(fetched.error());
                tally.errors++;
            }
            case SKIPPED -> throw new IllegalStateException("Skipped reference " + code + " cannot be applied");
        }
        metricsService.incrementReferenceOutcome(reference.getStatus());
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private enum Outcome { FOUND, NOT_FOUND, FAILED, SKIPPED }

    private record Fetched(Outcome outcome, WorldNetwork document, String error) {
        static Fetched found(WorldNetwork document) {
            return new Fetched(Outcome.FOUND, document, null);
        }

        static Fetched notFound() {
            return new Fetched(Outcome.NOT_FOUND, null, null);
        }

        static Fetched failed(String error) {
            return new Fetched(Outcome.FAILED, null, error);
        }

        static Fetched skipped() {
            return new Fetched(Outcome.SKIPPED, null, null);
        }
    }

    private record Deadline(long startNanos, Duration timeout) {
        boolean expired() {
            return timeout != null && System.nanoTime() - startNanos >= timeout.toNanos();
        }
    }

    private static final class Tally {
        private int attempted;
        private int resolved;
        private int notFound;
        private int errors;
        private int depthLimited;
        private int skippedByTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DocumentLocator locator;
        private StructuralParser parser;
        private GraphBuilder graphBuilder;
        private GraphMerger merger;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder locator(DocumentLocator locator) {
            this.locator = locator;
            return this;
        }

        /**
         * Parser used for referenced documents. Defaults to {@link StructuralParser#StructuralParser()}.
         */
        public Builder parser(StructuralParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder graphBuilder(GraphBuilder graphBuilder) {
            this.graphBuilder = graphBuilder;
            return this;
        }

        public Builder merger(GraphMerger merger) {
            this.merger = merger;
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

        public DeepLinkResolver build() {
            Objects.requireNonNull(locator, "locator is required");
            return new DeepLinkResolver(this);
        }
    }
}

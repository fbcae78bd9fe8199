package com.sop.network.resolve;

import com.sop.network.SopFixtures;
import com.sop.network.build.GraphBuilder;
import com.sop.network.core.model.Edge;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.ReferenceStatus;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.metrics.MetricsService;
import com.sop.network.tracing.Span;
import com.sop.network.tracing.SpanAttributes;
import com.sop.network.tracing.TracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("DeepLinkResolver Tests")
class DeepLinkResolverTest {

    private static final String LETTERS_CODE = "PR.OP.CL.2862";
    private static final String APPEALS_CODE = "PR.OP.CL.4000";

    private DocumentLocator locator;

    @BeforeEach
    void setUp() throws Exception {
        locator = mock(DocumentLocator.class);
        when(locator.locate(anyString())).thenReturn(LocatorResult.notFound());
    }

    private DeepLinkResolver resolver() {
        return DeepLinkResolver.builder().locator(locator).build();
    }

    @Nested
    @DisplayName("Single reference")
    class SingleReference {

        private WorldNetwork network;

        @BeforeEach
        void build() {
            network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");
        }

        @Test
        @DisplayName("Not found changes only that reference")
        void notFound() throws Exception {
            ResolutionSummary summary = resolver().resolveWithSummary(network, ResolverOptions.defaults());

            assertEquals(ReferenceStatus.NOT_FOUND, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            assertEquals(7, network.nodeCount());
            assertEquals(6, network.edgeCount());
            assertTrue(network.getLinkedProcedures().isEmpty());
            assertEquals(1, summary.attempted());
            assertEquals(1, summary.notFound());
            assertFalse(summary.isComplete());
            verify(locator, times(1)).locate(LETTERS_CODE);
        }

        @Test
        @DisplayName("Should merge the found document and stop at the depth limit")
        void resolvesWithinDepth() throws Exception {
            when(locator.locate(LETTERS_CODE)).thenReturn(LocatorResult.found(SopFixtures.LETTERS, "letters.md"));

            ResolutionSummary summary = resolver().resolveWithSummary(network, ResolverOptions.withMaxDepth(1));

            ProcedureReference letters = network.getReference(LETTERS_CODE).orElseThrow();
            assertEquals(ReferenceStatus.RESOLVED, letters.getStatus());
            assertEquals(network.getLinkedProcedures().get(LETTERS_CODE), letters.getLinkedRootId());

            ProcedureReference appeals = network.getReference(APPEALS_CODE).orElseThrow();
            assertEquals(ReferenceStatus.PENDING, appeals.getStatus());
            assertEquals(1, appeals.getDepth());
            assertEquals("PR.OP.CL.2862: Letter Claims Step 2", appeals.getSourceContext());

            assertEquals(1, summary.attempted());
            assertEquals(1, summary.resolved());
            assertEquals(1, summary.depthLimited());
            verify(locator, never()).locate(APPEALS_CODE);
        }

        @Test
        @DisplayName("Should deep-link the pointer to the linked root")
        void deepLink() throws Exception {
            when(locator.locate(LETTERS_CODE)).thenReturn(LocatorResult.found(SopFixtures.LETTERS, "letters.md"));

            resolver().resolveAll(network, 1);

            String linkedRoot = network.getLinkedProcedures().get(LETTERS_CODE);
            Node original = network.getNode("node_0007").orElseThrow();
            assertTrue(network.getOutgoingEdges(original.getId()).stream()
                    .anyMatch(e -> e.kind() == EdgeKind.DEEP_LINK && e.targetId().equals(linkedRoot)));
            assertEquals(NodeKind.LINKED_ROOT, network.getNode(linkedRoot).orElseThrow().getKind());
            assertTrue(network.findCategoryRoot("PR.OP.CL.2862/Letter Claims").isPresent());
        }

        @Test
        @DisplayName("Should follow chains up to the depth limit")
        void chain() throws Exception {
            when(locator.locate(LETTERS_CODE)).thenReturn(LocatorResult.found(SopFixtures.LETTERS, "letters.md"));
            when(locator.locate(APPEALS_CODE)).thenReturn(LocatorResult.found(SopFixtures.APPEALS, "appeals.md"));

            ResolutionSummary summary = resolver().resolveWithSummary(network, ResolverOptions.withMaxDepth(3));

            assertEquals(2, summary.resolved());
            assertTrue(summary.isComplete());
            assertEquals(2, SopFixtures.nodesOfKind(network, NodeKind.LINKED_ROOT).size());
            assertTrue(network.findCategoryRoot("PR.OP.CL.4000/Appeal Claims").isPresent());
        }

        @Test
        @DisplayName("Depth zero resolves nothing")
        void depthZero() throws Exception {
            ResolutionSummary summary = resolver().resolveWithSummary(network, ResolverOptions.withMaxDepth(0));

            assertEquals(ReferenceStatus.PENDING, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            assertEquals(1, summary.depthLimited());
            verify(locator, never()).locate(anyString());
        }

        @Test
        @DisplayName("An I/O failure marks the reference as error")
        void ioError() throws Exception {
            when(locator.locate(LETTERS_CODE)).thenThrow(new IOException("share unavailable"));

            ResolutionSummary summary = resolver().resolveWithSummary(network, ResolverOptions.defaults());

            ProcedureReference reference = network.getReference(LETTERS_CODE).orElseThrow();
            assertEquals(ReferenceStatus.ERROR, reference.getStatus());
            assertEquals("share unavailable", reference.getErrorMessage());
            assertEquals(1, summary.errors());
            assertEquals(7, network.nodeCount());
        }

        @Test
        @DisplayName("A zero timeout leaves everything pending")
        void timeout() throws Exception {
            ResolutionSummary summary = resolver().resolveWithSummary(network,
                    ResolverOptions.builder().timeout(Duration.ZERO).build());

            assertEquals(ReferenceStatus.PENDING, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            assertEquals(1, summary.skippedByTimeout());
            assertEquals(0, summary.depthLimited());
            verify(locator, never()).locate(anyString());
        }
    }

    @Nested
    @DisplayName("Repeated passes")
    class RepeatedPasses {

        @Test
        @DisplayName("Failed references stay failed unless retried")
        void retryFailed() throws Exception {
            WorldNetwork network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");
            when(locator.locate(LETTERS_CODE))
                    .thenReturn(LocatorResult.notFound())
                    .thenReturn(LocatorResult.found(SopFixtures.LETTERS, "letters.md"));

            resolver().resolveAll(network, 1);
            resolver().resolveAll(network, 1);
            assertEquals(ReferenceStatus.NOT_FOUND, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            verify(locator, times(1)).locate(LETTERS_CODE);

            resolver().resolveAll(network, ResolverOptions.builder().maxDepth(1).retryFailed(true).build());
            assertEquals(ReferenceStatus.RESOLVED, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            verify(locator, times(2)).locate(LETTERS_CODE);
        }

        @Test
        @DisplayName("Resolved references are never revisited")
        void monotonic() throws Exception {
            WorldNetwork network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");
            when(locator.locate(LETTERS_CODE)).thenReturn(LocatorResult.found(SopFixtures.LETTERS, "letters.md"));
            resolver().resolveAll(network, 1);
            int nodes = network.nodeCount();

            ResolutionSummary second = resolver().resolveWithSummary(network,
                    ResolverOptions.builder().maxDepth(1).retryFailed(true).build());

            assertEquals(0, second.attempted());
            assertEquals(nodes, network.nodeCount());
            assertEquals(ReferenceStatus.RESOLVED, network.getReference(LETTERS_CODE).orElseThrow().getStatus());
            verify(locator, times(1)).locate(LETTERS_CODE);
        }
    }

    @Nested
    @DisplayName("Cycles and self references")
    class Cycles {

        @ParameterizedTest
        @ValueSource(ints = {2, 10})
        @DisplayName("Mutually referencing documents are each merged once")
        void cycle(int maxDepth) throws Exception {
            WorldNetwork network = SopFixtures.build(SopFixtures.CYCLE_A, "sop-a");
            when(locator.locate("PR.OP.CL.2000")).thenReturn(LocatorResult.found(SopFixtures.CYCLE_B, "b.md"));
            when(locator.locate("PR.OP.CL.1000")).thenReturn(LocatorResult.found(SopFixtures.CYCLE_A, "a.md"));

            resolver().resolveAll(network, maxDepth);

            assertEquals(2, SopFixtures.nodesOfKind(network, NodeKind.LINKED_ROOT).size());
            verify(locator, times(1)).locate("PR.OP.CL.2000");
            verify(locator, times(1)).locate("PR.OP.CL.1000");
            network.getReferences().forEach(r -> assertEquals(ReferenceStatus.RESOLVED, r.getStatus(), r.getCode()));
        }

        @Test
        @DisplayName("A reference to the document itself links to its own root")
        void selfReference() throws Exception {
            WorldNetwork network = SopFixtures.build(SopFixtures.DUPLICATE_CLAIMS, "sop-1000");

            resolver().resolveAll(network, 3);

            ProcedureReference self = network.getReference("PR.OP.CL.1000").orElseThrow();
            assertEquals(ReferenceStatus.RESOLVED, self.getStatus());
            assertEquals(network.getRootId(), self.getLinkedRootId());
            assertEquals(network.getRootId(), network.getLinkedProcedures().get("PR.OP.CL.1000"));

            Node pointer = network.findReferenceNodes("PR.OP.CL.1000").get(0);
            List<Edge> links = network.getOutgoingEdges(pointer.getId());
            assertEquals(1, links.size());
            assertEquals(EdgeKind.DEEP_LINK, links.get(0).kind());
            assertEquals(network.getRootId(), links.get(0).targetId());

            verify(locator, never()).locate("PR.OP.CL.1000");
            assertTrue(SopFixtures.nodesOfKind(network, NodeKind.LINKED_ROOT).isEmpty());
        }
    }

    @Nested
    @DisplayName("Time budget")
    class TimeBudget {

        private static final String THREE_REFERENCES = """
                # **Routing**

                ### **Routing Claims**
                1. Refer to PR.OP.CL.5001.
                2. Refer to PR.OP.CL.5002.
                3. Refer to PR.OP.CL.5003.
                """;

        private WorldNetwork network;

        @BeforeEach
        void slowLocator() throws Exception {
            network = SopFixtures.build(THREE_REFERENCES, "sop-routing");
            doAnswer(invocation -> {
                Thread.sleep(300);
                return LocatorResult.notFound();
            }).when(locator).locate(anyString());
        }

        @Test
        @DisplayName("No fetch starts once the budget has run out mid-level")
        void expiresMidLevel() throws Exception {
            ResolutionSummary summary = resolver().resolveWithSummary(network,
                    ResolverOptions.builder().timeout(Duration.ofMillis(100)).build());

            verify(locator, times(1)).locate(anyString());
            verify(locator).locate("PR.OP.CL.5001");
            assertEquals(1, summary.attempted());
            assertEquals(1, summary.notFound());
            assertEquals(2, summary.skippedByTimeout());
            assertEquals(0, summary.depthLimited());
            assertEquals(ReferenceStatus.PENDING, network.getReference("PR.OP.CL.5002").orElseThrow().getStatus());
            assertEquals(ReferenceStatus.PENDING, network.getReference("PR.OP.CL.5003").orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Queued parallel fetches are skipped once the budget has run out")
        void expiresWhileQueued() throws Exception {
            ResolutionSummary summary = resolver().resolveWithSummary(network,
                    ResolverOptions.builder().timeout(Duration.ofMillis(100)).maxConcurrency(2).build());

            verify(locator, times(2)).locate(anyString());
            assertEquals(2, summary.attempted());
            assertEquals(1, summary.skippedByTimeout());
            assertEquals(1, network.getReferences(ReferenceStatus.PENDING).size());
            assertTrue(network.getReferences(ReferenceStatus.RESOLVING).isEmpty());
        }

        @Test
        @DisplayName("Skipped references are fetched by the next pass")
        void nextPassPicksUpSkipped() throws Exception {
            resolver().resolveAll(network, ResolverOptions.builder().timeout(Duration.ofMillis(100)).build());
            ResolutionSummary second = resolver().resolveWithSummary(network, ResolverOptions.withMaxDepth(1));

            assertEquals(2, second.attempted());
            assertTrue(network.getReferences(ReferenceStatus.PENDING).isEmpty());
        }
    }

    @Test
    @DisplayName("Parallel fetching gives the same network as sequential")
    void parallelMatchesSequential() {
        Map<String, String> documents = Map.of(
                LETTERS_CODE, SopFixtures.LETTERS,
                "PR.OP.CL.3000", SopFixtures.APPEALS);
        DocumentLocator mapLocator = code -> documents.containsKey(code)
                ? LocatorResult.found(documents.get(code), code) : LocatorResult.notFound();
        DeepLinkResolver resolver = DeepLinkResolver.builder().locator(mapLocator).build();

        WorldNetwork sequential = SopFixtures.build(SopFixtures.DUPLICATE_CLAIMS, "sop-1000");
        resolver.resolveAll(sequential, ResolverOptions.builder().maxDepth(3).build());
        WorldNetwork parallel = SopFixtures.build(SopFixtures.DUPLICATE_CLAIMS, "sop-1000");
        resolver.resolveAll(parallel, ResolverOptions.builder().maxDepth(3).maxConcurrency(4).build());

        assertEquals(describe(sequential), describe(parallel));
        assertEquals(List.copyOf(sequential.getEdges()), List.copyOf(parallel.getEdges()));
        assertEquals(ReferenceStatus.NOT_FOUND, parallel.getReference(APPEALS_CODE).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should report outcomes to the metrics service")
    void metrics() {
        MetricsService metrics = mock(MetricsService.class);
        WorldNetwork network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");

        DeepLinkResolver.builder().locator(locator).metricsService(metrics).build()
                .resolveAll(network, 1);

        verify(metrics).incrementReferenceOutcome(ReferenceStatus.NOT_FOUND);
        verify(metrics).recordResolutionDuration(any(Duration.class));
    }

    @Test
    @DisplayName("Should trace the pass and each fetched reference")
    void tracing() throws Exception {
        TracingService tracing = mock(TracingService.class);
        Span passSpan = mock(Span.class);
        Span referenceSpan = mock(Span.class);
        when(tracing.startResolution("sop-amazon")).thenReturn(passSpan);
        when(tracing.startReference(LETTERS_CODE)).thenReturn(referenceSpan);
        when(locator.locate(LETTERS_CODE)).thenThrow(new IOException("share unavailable"));
        WorldNetwork network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");

        DeepLinkResolver.builder().locator(locator).tracingService(tracing)
                .graphBuilder(new GraphBuilder()).build()
                .resolveAll(network, 1);

        verify(referenceSpan).setAttribute(SpanAttributes.REFERENCE_DEPTH, 0L);
        verify(referenceSpan).setAttribute(SpanAttributes.REFERENCE_OUTCOME, "error");
        verify(referenceSpan).fail(any(IOException.class));
        verify(referenceSpan).close();
        verify(passSpan).setAttribute(SpanAttributes.REFERENCES_RESOLVED, 0L);
        verify(passSpan).succeed();
    }

    @Test
    @DisplayName("A locator is required")
    void locatorRequired() {
        assertThrows(NullPointerException.class, () -> DeepLinkResolver.builder().build());
    }

    private static List<String> describe(WorldNetwork network) {
        return network.getNodes().stream()
                .map(n -> n.getId() + "|" + n.getKind() + "|" + n.getContent())
                .toList();
    }
}

package com.sop.network.build;

import com.sop.network.SopFixtures;
import com.sop.network.core.model.Edge;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.Entity;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.ReferenceStatus;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.parse.StructuralParser;
import com.sop.network.parse.StructuralRecord;
import com.sop.network.tracing.Span;
import com.sop.network.tracing.SpanAttributes;
import com.sop.network.tracing.TracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GraphBuilder Tests")
class GraphBuilderTest {

    private static final Pattern CODE = Pattern.compile("PR\\.OP\\.CL\\.\\d+");

    @Nested
    @DisplayName("Single decision document")
    class AmazonNetwork {

        private WorldNetwork network;

        @BeforeEach
        void build() {
            network = SopFixtures.build(SopFixtures.AMAZON, "sop-amazon");
        }

        @Test
        @DisplayName("Should create one category under the root")
        void category() {
            assertEquals(7, network.nodeCount());
            assertEquals(6, network.edgeCount());
            assertEquals("node_0001", network.getRootId());
            assertEquals(List.of("Amazon Claims"), List.copyOf(network.getClaimTypeRoots().keySet()));
            assertEquals("node_0002", network.findCategoryRoot("Amazon Claims").orElseThrow());
        }

        @Test
        @DisplayName("Should expand the decision into Yes and No branches")
        void decision() {
            Node decision = SopFixtures.onlyNode(network, NodeKind.DECISION, "Is the provider Vita Health?");
            assertEquals(1, decision.getStepNumber());
            assertTrue(decision.hasFlag(Node.META_IS_DECISION));
            assertEquals(List.of("provider_name_vita_health"), decision.getEntityIds());

            List<Edge> outgoing = network.getOutgoingEdges(decision.getId());
            assertEquals(List.of(EdgeKind.CONDITION_YES, EdgeKind.CONDITION_NO, EdgeKind.SEQUENCE),
                    outgoing.stream().map(Edge::kind).toList());
            assertEquals("YES", outgoing.get(0).condition());

            Node yes = network.getNode(outgoing.get(0).targetId()).orElseThrow();
            assertEquals(NodeKind.BRANCH_YES, yes.getKind());
            assertTrue(yes.getEntityIds().contains("provider_id_ABC123DEF"));

            Node no = network.getNode(outgoing.get(1).targetId()).orElseThrow();
            assertTrue(no.hasFlag(Node.META_CONTINUE_TO_STEP));
        }

        @Test
        @DisplayName("Should leave a pending pointer for the plain step's reference")
        void reference() {
            Node step = SopFixtures.onlyNode(network, NodeKind.STEP, "Refer to PR.OP.CL.2862.");
            assertEquals(List.of("PR.OP.CL.2862"), step.getMetadata(Node.META_PROCEDURE_REFS));

            List<Edge> children = network.getOutgoingEdges(step.getId());
            assertEquals(1, children.size());
            assertEquals(EdgeKind.REFERENCE, children.get(0).kind());

            Node pointer = network.getNode(children.get(0).targetId()).orElseThrow();
            assertEquals(NodeKind.REFERENCE, pointer.getKind());
            assertEquals("PR.OP.CL.2862", pointer.getMetadata(Node.META_REFERENCE_CODE));

            ProcedureReference reference = network.getReference("PR.OP.CL.2862").orElseThrow();
            assertEquals(ReferenceStatus.PENDING, reference.getStatus());
            assertEquals("Amazon Claims Step 2", reference.getSourceContext());
            assertEquals(0, reference.getDepth());
        }

        @Test
        @DisplayName("Document name falls back to the key without a title")
        void nameFallback() {
            assertEquals("sop-amazon", network.getDocumentName());
            WorldNetwork named = new GraphBuilder().build(new StructuralParser().parse(SopFixtures.AMAZON),
                    "sop-amazon", "Amazon Handling");
            assertEquals("Amazon Handling", named.getDocumentName());
        }
    }

    @Nested
    @DisplayName("Full document")
    class DuplicateClaimsNetwork {

        private WorldNetwork network;

        @BeforeEach
        void build() {
            network = SopFixtures.build(SopFixtures.DUPLICATE_CLAIMS, "sop-1000");
        }

        @Test
        @DisplayName("Should build every node and edge")
        void counts() {
            assertEquals(18, network.nodeCount());
            assertEquals(18, network.edgeCount());
            assertEquals(4, SopFixtures.nodesOfKind(network, NodeKind.REFERENCE).size());
            assertEquals(List.of("Amazon Claims", "Care Medical Claims"),
                    List.copyOf(network.getClaimTypeRoots().keySet()));
        }

        @Test
        @DisplayName("Should copy header fields and versions")
        void metadata() {
            assertEquals("Duplicate Claims Handling", network.getDocumentName());
            assertEquals("PR.OP.CL.1000", network.getMetadata().get("document_number"));
            assertEquals("D12", network.getMetadata().get("pend_code"));
            assertEquals("Active", network.getMetadata().get("status"));
            assertEquals(WorldNetwork.SOURCE_TYPE, network.getMetadata().get("source_type"));
            assertEquals("2.0", network.getCurrentVersion());
            assertEquals(2, network.getVersions().size());

            Entity pendCode = network.getEntity("pend_code_D12").orElseThrow();
            assertEquals(Boolean.TRUE, pendCode.getAttributes().get(GraphBuilder.DOCUMENT_PEND_CODE));
        }

        @Test
        @DisplayName("Should register references in the order they are found")
        void referenceOrder() {
            List<ProcedureReference> references = List.copyOf(network.getReferences());

            assertEquals(List.of("PR.OP.CL.2862", "PR.OP.CL.1000", "PR.OP.CL.3000"),
                    references.stream().map(ProcedureReference::getCode).toList());
            assertEquals("Letters", references.get(0).getTitle());
            assertEquals("document", references.get(1).getSourceContext());
            assertEquals("Pend Basics for background", references.get(2).getTitle());
        }

        @Test
        @DisplayName("Document-level references hang off the root")
        void documentLevelReferences() {
            for (String code : List.of("PR.OP.CL.1000", "PR.OP.CL.3000")) {
                Node pointer = network.findReferenceNodes(code).get(0);
                assertEquals(network.getRootId(), pointer.getParentId());
            }
            assertEquals(2, network.findReferenceNodes("PR.OP.CL.2862").size());
        }

        @Test
        @DisplayName("Should link proceed-to-section branches to the named category")
        void proceedToSection() {
            List<Edge> proceed = network.getEdges().stream()
                    .filter(e -> e.kind() == EdgeKind.PROCEED_TO_SECTION)
                    .toList();

            assertEquals(1, proceed.size());
            assertEquals(network.findCategoryRoot("Amazon Claims").orElseThrow(), proceed.get(0).targetId());
            Node source = network.getNode(proceed.get(0).sourceId()).orElseThrow();
            assertEquals(NodeKind.BRANCH_YES, source.getKind());
            assertEquals("Amazon Claims", source.getMetadata(Node.META_PROCEED_TO_SECTION));
        }

        @Test
        @DisplayName("Should nest sub-conditions and labeled actions under the No branch")
        void subConditions() {
            Node no = SopFixtures.onlyNode(network, NodeKind.BRANCH_NO, "Deny the claim.");
            List<EdgeKind> kinds = network.getOutgoingEdges(no.getId()).stream().map(Edge::kind).toList();
            assertEquals(List.of(EdgeKind.NESTED_YES, EdgeKind.NESTED_NO, EdgeKind.NESTED_CONDITION), kinds);

            Node labeled = SopFixtures.nodesOfKind(network, NodeKind.ACTION).get(0);
            assertEquals("Provider-submitted", labeled.getMetadata(Node.META_SCENARIO));
            assertTrue(labeled.getEntityIds().contains("pend_code_D12"));
        }

        @Test
        @DisplayName("Should keep notes on the step")
        void notes() {
            Node decision = SopFixtures.onlyNode(network, NodeKind.DECISION, "Does the claim carry TIN 123456789?");
            assertEquals(List.of("Always check the group number 1234567."), decision.getMetadata(Node.META_NOTES));
            assertTrue(decision.getEntityIds().contains("tin_123456789"));
        }

        @Test
        @DisplayName("Should capture the clinic table and its provider entities")
        void tables() {
            assertEquals(List.of("care_medical_clinics"), List.copyOf(network.getLookupTables().keySet()));

            Entity idaho = network.getEntity("provider_id_CMI0001AB").orElseThrow();
            assertEquals("Care Medical Idaho", idaho.getAttributes().get("clinic_name"));
            assertEquals("Idaho", idaho.getAttributes().get("location"));
            assertEquals("123456789", idaho.getAttributes().get("tin"));

            assertTrue(network.getEntity("npi_0987654321").isPresent());
            assertTrue(network.getEntity("tin_987654321").isPresent());
            assertTrue(network.getEntity("group_number_1234567").isPresent());
        }
    }

    @Nested
    @DisplayName("Graph invariants")
    class Invariants {

        @ParameterizedTest
        @ValueSource(strings = {"AMAZON", "DUPLICATE_CLAIMS", "LETTERS", "CYCLE_A"})
        @DisplayName("Every node is reachable from the root")
        void connectivity(String fixture) {
            WorldNetwork network = SopFixtures.build(fixture(fixture), "sop");

            Set<String> seen = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(network.getRootId());
            while (!stack.isEmpty()) {
                String id = stack.pop();
                if (seen.add(id)) {
                    network.getOutgoingEdges(id).forEach(e -> stack.push(e.targetId()));
                }
            }
            assertEquals(network.nodeCount(), seen.size());
        }

        @ParameterizedTest
        @ValueSource(strings = {"AMAZON", "DUPLICATE_CLAIMS", "LETTERS", "CYCLE_B"})
        @DisplayName("Every reference code in the text is registered")
        void referenceCompleteness(String fixture) {
            String text = fixture(fixture);
            WorldNetwork network = SopFixtures.build(text, "sop");

            Set<String> scanned = new LinkedHashSet<>();
            Matcher matcher = CODE.matcher(text);
            while (matcher.find()) {
                scanned.add(matcher.group());
            }
            Set<String> registered = new HashSet<>();
            network.getReferences().forEach(r -> registered.add(r.getCode()));
            assertEquals(scanned, registered);
            scanned.forEach(code -> assertFalse(network.findReferenceNodes(code).isEmpty(), code));
        }

        @Test
        @DisplayName("Building twice yields identical ids")
        void determinism() {
            StructuralRecord record = new StructuralParser().parse(SopFixtures.DUPLICATE_CLAIMS);
            WorldNetwork first = new GraphBuilder().build(record, "sop-1000");
            WorldNetwork second = new GraphBuilder().build(record, "sop-1000");

            assertEquals(describe(first), describe(second));
            assertEquals(List.copyOf(first.getEdges()), List.copyOf(second.getEdges()));
            assertEquals(first.getClaimTypeRoots(), second.getClaimTypeRoots());
        }

        @Test
        @DisplayName("Empty input still yields a root")
        void emptyDocument() {
            WorldNetwork network = SopFixtures.build("", "sop-empty");
            assertEquals(1, network.nodeCount());
            assertEquals(0, network.edgeCount());
            assertEquals("sop-empty", network.getDocumentName());
        }

        private List<String> describe(WorldNetwork network) {
            return network.getNodes().stream()
                    .map(n -> n.getId() + "|" + n.getKind() + "|" + n.getContent() + "|" + n.getParentId())
                    .toList();
        }

        private String fixture(String name) {
            return switch (name) {
                case "AMAZON" -> SopFixtures.AMAZON;
                case "DUPLICATE_CLAIMS" -> SopFixtures.DUPLICATE_CLAIMS;
                case "LETTERS" -> SopFixtures.LETTERS;
                case "CYCLE_A" -> SopFixtures.CYCLE_A;
                case "CYCLE_B" -> SopFixtures.CYCLE_B;
                default -> throw new IllegalArgumentException(name);
            };
        }
    }

    @Test
    @DisplayName("Should trace the build")
    void tracing() {
        TracingService tracing = mock(TracingService.class);
        Span span = mock(Span.class);
        when(tracing.startBuild("sop-amazon")).thenReturn(span);

        new GraphBuilder(tracing).build(new StructuralParser().parse(SopFixtures.AMAZON), "sop-amazon");

        verify(span).setAttribute(SpanAttributes.NETWORK_NODES, 7L);
        verify(span).setAttribute(SpanAttributes.NETWORK_REFERENCES, 1L);
        verify(span).succeed();
        verify(span, never()).fail(any());
        verify(span).close();
    }
}

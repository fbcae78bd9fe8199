package com.sop.network.build;

import com.sop.network.core.model.CategoryKey;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.Entity;
import com.sop.network.core.model.EntityMention;
import com.sop.network.core.model.EntityType;
import com.sop.network.core.model.LookupEntry;
import com.sop.network.core.model.LookupTable;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.Version;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.extract.ExtractedEntity;
import com.sop.network.parse.BranchRecord;
import com.sop.network.parse.CategorySection;
import com.sop.network.parse.DocumentHeader;
import com.sop.network.parse.ReferenceMention;
import com.sop.network.parse.RevisionEntry;
import com.sop.network.parse.StepRecord;
import com.sop.network.parse.StructuralRecord;
import com.sop.network.parse.SubConditionRecord;
import com.sop.network.tracing.NoOpTracingService;
import com.sop.network.tracing.Span;
import com.sop.network.tracing.SpanAttributes;
import com.sop.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link StructuralRecord} into a {@link WorldNetwork}.
 *
 * <p>Node and edge ids come from the network's own counters and are allocated
 * in a fixed walk order (root, then per category: category node, steps in
 * order, each step followed by its branches, sub-conditions and reference
 * pointers), so the same record always yields the same ids. The builder
 * keeps no state between calls and may be shared.</p>
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    static final String DOCUMENT_PEND_CODE = "document_pend_code";

    private final TracingService tracingService;

    public GraphBuilder() {
        this(new NoOpTracingService());
    }

    public GraphBuilder(TracingService tracingService) {
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
    }

    public WorldNetwork build(StructuralRecord record, String documentKey) {
        return build(record, documentKey, null);
    }

    /**
     * Builds the unresolved network of one document. Every reference code found
     * is registered as a pending reference.
     */
    public WorldNetwork build(StructuralRecord record, String documentKey, String documentName) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(documentKey, "documentKey is required");

        DocumentHeader header = record.header();
        String name = documentName != null && !documentName.isBlank() ? documentName
                : !header.title().isEmpty() ? header.title() : documentKey;

        try (Span span = tracingService.startBuild(documentKey)) {
            WorldNetwork network = new WorldNetwork(documentKey, name);
            putHeaderMetadata(network, header);
            for (RevisionEntry revision : record.revisions()) {
                network.addVersion(Version.of(revision.revision(), revision.date(), revision.description()));
            }

            Node root = network.addNode(Node.builder(NodeKind.ROOT)
                    .content(name)
                    .metadata("document_number", emptyToNull(header.documentNumber())));
            registerDocumentPendCode(network, header);

            BuildContext context = new BuildContext(network);
            for (CategorySection category : record.categories()) {
                buildCategory(context, root, category);
            }
            linkProceedToSection(context);
            attachDocumentLevelReferences(network, root, record.references());

            for (ExtractedEntity hit : record.entities()) {
                network.recordEntity(hit.type(), hit.value(), hit.normalizedValue(), EntityMention.document());
            }
            for (LookupTable table : record.tables()) {
                network.addLookupTable(table);
                registerTableEntities(network, table);
            }

            span.setAttribute(SpanAttributes.NETWORK_NODES, network.nodeCount());
            span.setAttribute(SpanAttributes.NETWORK_REFERENCES, network.getReferences().size());
            span.succeed();
            log.info("network.built documentId={} nodes={} edges={} categories={} references={}",
                    documentKey, network.nodeCount(), network.edgeCount(),
                    network.getCategoryRoots().size(), network.getReferences().size());
            return network;
        }
    }

    // --- header ---

    private void putHeaderMetadata(WorldNetwork network, DocumentHeader header) {
        network.putMetadata("title", emptyToNull(header.title()));
        network.putMetadata("document_type", emptyToNull(header.documentType()));
        network.putMetadata("document_number", emptyToNull(header.documentNumber()));
        network.putMetadata("status", emptyToNull(header.status()));
        network.putMetadata("cause_explanation", emptyToNull(header.causeExplanation()));
        network.putMetadata("pend_code", emptyToNull(header.pendCode()));
    }

    private void registerDocumentPendCode(WorldNetwork network, DocumentHeader header) {
        if (header.pendCode().isEmpty()) {
            return;
        }
        String code = header.pendCode().toUpperCase(Locale.ROOT);
        Entity entity = network.recordEntity(EntityType.PEND_CODE, header.pendCode(), code, EntityMention.document());
        entity.putAttributeIfAbsent(DOCUMENT_PEND_CODE, true);
    }

    // --- categories and steps ---

    private void buildCategory(BuildContext context, Node root, CategorySection category) {
        WorldNetwork network = context.network;
        Node categoryNode = network.addNode(Node.builder(NodeKind.CATEGORY)
                .content(category.name())
                .parentId(root.getId())
                .section(category.name()));
        network.addEdge(root.getId(), categoryNode.getId(), EdgeKind.CONTAINS);
        network.registerCategory(CategoryKey.nativeCategory(category.name()), categoryNode.getId());
        context.categoryNodes.add(categoryNode);

        String previous = categoryNode.getId();
        for (StepRecord step : category.steps()) {
            previous = buildStep(context, previous, categoryNode, category.name(), step);
        }
    }

    /**
     * Creates the step node, links it from {@code previousId} and expands its branches.
     *
     * @return id of the step node, the next "previous" pointer
     */
    private String buildStep(BuildContext context, String previousId, Node categoryNode,
                             String section, StepRecord step) {
        WorldNetwork network = context.network;
        String content = step.leadText().isEmpty() ? "Step " + step.number() : step.leadText();
        Node stepNode = network.addNode(Node.builder(step.decision() ? NodeKind.DECISION : NodeKind.STEP)
                .content(content)
                .stepNumber(step.number())
                .parentId(categoryNode.getId())
                .section(section)
                .metadata(Node.META_IS_DECISION, step.decision())
                .metadata(Node.META_NOTES, step.notes().isEmpty() ? null : step.notes())
                .metadata(Node.META_RAW, step.rawExcerpt())
                .metadata(Node.META_PROCEDURE_REFS, codesOf(step.references())));
        network.addEdge(previousId, stepNode.getId(), EdgeKind.SEQUENCE);

        EntityMention mention = new EntityMention(section, step.number());
        attachEntities(network, stepNode, step.entities(), mention);
        attachReferences(network, stepNode, step.references(), section, step.number());

        if (step.decision() && step.branches().isEmpty()) {
            log.debug("build.decisionWithoutBranches section='{}' step={}", section, step.number());
        }
        for (BranchRecord branch : step.branches()) {
            buildBranch(context, stepNode, section, step.number(), branch);
        }
        return stepNode.getId();
    }

    // --- branches ---

    private void buildBranch(BuildContext context, Node decision, String section, int stepNumber,
                             BranchRecord branch) {
        WorldNetwork network = context.network;
        NodeKind nodeKind = switch (branch.kind()) {
            case YES -> NodeKind.BRANCH_YES;
            case NO -> NodeKind.BRANCH_NO;
            case UNSURE -> NodeKind.BRANCH_UNSURE;
        };
        EdgeKind edgeKind = switch (branch.kind()) {
            case YES -> EdgeKind.CONDITION_YES;
            case NO -> EdgeKind.CONDITION_NO;
            case UNSURE -> EdgeKind.CONDITION_UNSURE;
        };

        Node branchNode = network.addNode(Node.builder(nodeKind)
                .content(branch.action())
                .stepNumber(stepNumber)
                .parentId(decision.getId())
                .section(section)
                .metadata(Node.META_CONDITION, branch.kind().getLabel())
                .metadata(Node.META_CONTINUE_TO_STEP, branch.continueToStep() ? Boolean.TRUE : null)
                .metadata(Node.META_PROCEED_TO_SECTION, branch.proceedToSection())
                .metadata(Node.META_PROCEDURE_REFS, codesOf(branch.references())));
        network.addEdge(decision.getId(), branchNode.getId(), edgeKind, branch.kind().getLabel());

        EntityMention mention = new EntityMention(section, stepNumber);
        attachEntities(network, branchNode, branch.entities(), mention);

        for (SubConditionRecord sub : branch.subConditions()) {
            buildSubCondition(network, branchNode, section, stepNumber, sub);
        }
        attachReferences(network, branchNode, branch.references(), section, stepNumber);

        if (branch.proceedToSection() != null) {
            context.proceedRequests.add(new ProceedRequest(branchNode.getId(), branch.proceedToSection()));
        }
    }

    private void buildSubCondition(WorldNetwork network, Node branchNode, String section, int stepNumber,
                                   SubConditionRecord sub) {
        Node.Builder builder = switch (sub.kind()) {
            case NESTED_YES, NESTED_NO -> Node.builder(NodeKind.SUB_CONDITION)
                    .metadata(Node.META_CONDITION, sub.label());
            case LABELED -> Node.builder(NodeKind.ACTION)
                    .metadata(Node.META_SCENARIO, sub.label());
        };
        EdgeKind edgeKind = switch (sub.kind()) {
            case NESTED_YES -> EdgeKind.NESTED_YES;
            case NESTED_NO -> EdgeKind.NESTED_NO;
            case LABELED -> EdgeKind.NESTED_CONDITION;
        };
        Node subNode = network.addNode(builder
                .content(sub.text())
                .stepNumber(stepNumber)
                .parentId(branchNode.getId())
                .section(section)
                .metadata(Node.META_PROCEDURE_REFS, codesOf(sub.references())));
        network.addEdge(branchNode.getId(), subNode.getId(), edgeKind, sub.label());

        attachEntities(network, subNode, sub.entities(), new EntityMention(section, stepNumber));
        attachReferences(network, subNode, sub.references(), section, stepNumber);
    }

    // --- references ---

    private void attachReferences(WorldNetwork network, Node parent, List<ReferenceMention> references,
                                  String section, Integer stepNumber) {
        String sourceContext = stepNumber != null ? section + " Step " + stepNumber : section;
        for (ReferenceMention reference : references) {
            addReferencePointer(network, parent, reference, section, sourceContext);
        }
    }

    private void addReferencePointer(WorldNetwork network, Node parent, ReferenceMention reference,
                                     String section, String sourceContext) {
        String content = "Refer to: " + reference.code()
                + (reference.hasTitle() ? " - " + reference.title() : "");
        Node pointer = network.addNode(Node.builder(NodeKind.REFERENCE)
                .content(content)
                .stepNumber(parent.getStepNumber())
                .parentId(parent.getId())
                .section(section)
                .metadata(Node.META_REFERENCE_CODE, reference.code()));
        network.addEdge(parent.getId(), pointer.getId(), EdgeKind.REFERENCE);
        network.registerReference(reference.code(), reference.title(), sourceContext, 0);
    }

    /**
     * Codes found outside any step (header, intro text, skipped sections) hang off the root.
     */
    private void attachDocumentLevelReferences(WorldNetwork network, Node root, List<ReferenceMention> references) {
        for (ReferenceMention reference : references) {
            if (network.hasReference(reference.code())) {
                network.getReference(reference.code()).ifPresent(r -> r.offerTitle(reference.title()));
                continue;
            }
            addReferencePointer(network, root, reference, null, EntityMention.DOCUMENT_SECTION);
        }
    }

    private void linkProceedToSection(BuildContext context) {
        for (ProceedRequest request : context.proceedRequests) {
            findCategory(context.categoryNodes, request.sectionName()).ifPresentOrElse(
                    category -> context.network.addEdge(request.branchId(), category.getId(),
                            EdgeKind.PROCEED_TO_SECTION, category.getContent()),
                    () -> log.debug("build.proceedTargetUnknown section='{}'", request.sectionName()));
        }
    }

    static Optional<Node> findCategory(List<Node> categories, String sectionName) {
        String wanted = simplify(sectionName);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        Optional<Node> exact = categories.stream()
                .filter(c -> simplify(c.getContent()).equals(wanted))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return categories.stream()
                .filter(c -> {
                    String name = simplify(c.getContent());
                    return !name.isEmpty() && (wanted.contains(name) || name.contains(wanted));
                })
                .findFirst();
    }

    private static String simplify(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    // --- entities ---

    private void attachEntities(WorldNetwork network, Node node, List<ExtractedEntity> entities,
                                EntityMention mention) {
        for (ExtractedEntity hit : entities) {
            Entity entity = network.recordEntity(hit.type(), hit.value(), hit.normalizedValue(), mention);
            network.attachEntity(node.getId(), entity.getId());
        }
    }

    private void registerTableEntities(WorldNetwork network, LookupTable table) {
        EntityMention mention = new EntityMention(table.name(), null);
        for (LookupEntry entry : table.entries()) {
            if (entry.providerId() != null) {
                Entity provider = network.recordEntity(EntityType.PROVIDER_ID, entry.providerId(),
                        entry.providerId().toUpperCase(Locale.ROOT), mention);
                provider.putAttributeIfAbsent("clinic_name", entry.name());
                if (entry.location() != null) {
                    provider.putAttributeIfAbsent("location", entry.location());
                }
                if (entry.tin() != null) {
                    provider.putAttributeIfAbsent("tin", entry.tin());
                }
            }
            if (entry.tin() != null) {
                network.recordEntity(EntityType.TAX_ID, entry.tin(), entry.tin(), mention);
            }
            if (entry.npi() != null) {
                Entity npi = network.recordEntity(EntityType.NPI, entry.npi(), entry.npi(), mention);
                npi.putAttributeIfAbsent("clinic_name", entry.name());
            }
        }
    }

    private static List<String> codesOf(List<ReferenceMention> references) {
        return references.isEmpty() ? null : references.stream().map(ReferenceMention::code).toList();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private record ProceedRequest(String branchId, String sectionName) {
    }

    private static final class BuildContext {
        private final WorldNetwork network;
        private final List<Node> categoryNodes = new ArrayList<>();
        private final List<ProceedRequest> proceedRequests = new ArrayList<>();

        private BuildContext(WorldNetwork network) {
            this.network = network;
        }
    }
}

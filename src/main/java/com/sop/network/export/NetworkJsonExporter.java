package com.sop.network.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sop.network.core.model.Edge;
import com.sop.network.core.model.Entity;
import com.sop.network.core.model.EntityMention;
import com.sop.network.core.model.LookupEntry;
import com.sop.network.core.model.LookupTable;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.Version;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.observation.ObservationNetwork;
import com.sop.network.observation.ObservationSummary;
import com.sop.network.query.NetworkStatistics;
import com.sop.network.query.NetworkSubgraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders networks, subgraphs and statistics as JSON trees.
 *
 * <p>Field names are snake_case and node/edge kinds are written as their tags.
 * Tools downstream read this layout, so keys are only ever added.</p>
 */
public class NetworkJsonExporter {
    private static final Logger log = LoggerFactory.getLogger(NetworkJsonExporter.class);

    private final ObjectWriter writer;

    public NetworkJsonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public NetworkJsonExporter(ObjectMapper objectMapper) {
        this.writer = Objects.requireNonNull(objectMapper, "objectMapper is required").writer();
    }

    // --- networks ---

    public String toJson(WorldNetwork network) {
        return write(toTree(network), network.getDocumentId());
    }

    /**
     * Writes the network to a UTF-8 file, replacing it if present.
     */
    public void write(WorldNetwork network, Path target) {
        String json = toJson(network);
        try {
            Files.writeString(target, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NetworkExportException("Failed to write network " + network.getDocumentId()
                    + " to " + target, e);
        }
        log.info("export.written document={} path={} bytes={}", network.getDocumentId(), target, json.length());
    }

    public Map<String, Object> toTree(WorldNetwork network) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("document_id", network.getDocumentId());
        tree.put("document_name", network.getDocumentName());
        tree.put("root_id", network.getRootId());
        tree.put("current_version", network.getCurrentVersion());
        tree.put("metadata", network.getMetadata());
        tree.put("claim_type_roots", network.getClaimTypeRoots());
        tree.put("linked_procedures", network.getLinkedProcedures());

        Map<String, Object> nodes = new LinkedHashMap<>();
        network.getNodes().forEach(n -> nodes.put(n.getId(), nodeTree(n)));
        tree.put("nodes", nodes);

        Map<String, Object> edges = new LinkedHashMap<>();
        network.getEdges().forEach(e -> edges.put(e.id(), edgeTree(e)));
        tree.put("edges", edges);

        tree.put("versions", network.getVersions().stream().map(NetworkJsonExporter::versionTree).toList());

        Map<String, Object> references = new LinkedHashMap<>();
        network.getReferences().forEach(r -> references.put(r.getCode(), referenceTree(r)));
        tree.put("procedure_refs", references);

        Map<String, Object> entities = new LinkedHashMap<>();
        network.getEntities().forEach(e -> entities.put(e.getId(), entityTree(e)));
        tree.put("entities", entities);

        Map<String, Object> tables = new LinkedHashMap<>();
        network.getLookupTables().forEach((name, table) -> tables.put(name, tableTree(table)));
        tree.put("lookup_tables", tables);
        return tree;
    }

    // --- views ---

    public String toJson(NetworkSubgraph subgraph) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("key", subgraph.key());
        tree.put("root_id", subgraph.rootId());
        Map<String, Object> nodes = new LinkedHashMap<>();
        subgraph.nodes().forEach(n -> nodes.put(n.getId(), nodeTree(n)));
        tree.put("nodes", nodes);
        Map<String, Object> edges = new LinkedHashMap<>();
        subgraph.edges().forEach(e -> edges.put(e.id(), edgeTree(e)));
        tree.put("edges", edges);
        return write(tree, subgraph.key());
    }

    public String toJson(NetworkStatistics stats) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("total_nodes", stats.totalNodes());
        tree.put("total_edges", stats.totalEdges());
        tree.put("node_types", stats.nodesByKind());
        tree.put("edge_types", stats.edgesByKind());
        tree.put("reference_status", stats.referencesByStatus());
        tree.put("category_max_depths", stats.categoryMaxDepths());
        tree.put("decision_points", stats.decisionPoints());
        tree.put("entities", stats.entityCount());
        tree.put("versions", stats.versionCount());
        tree.put("current_version", stats.currentVersion());
        tree.put("claim_types", stats.categories());
        tree.put("lookup_tables", stats.lookupTableSizes());
        tree.put("linked_procedures", stats.linkedProcedures());
        return write(tree, "statistics");
    }

    public String toJson(ObservationNetwork observations) {
        Map<String, Object> tree = new LinkedHashMap<>();
        Map<String, Object> entities = new LinkedHashMap<>();
        observations.getEntities().forEach(e -> entities.put(e.getId(), entityTree(e)));
        tree.put("entities", entities);
        tree.put("provider_lookup", observations.getProviderLookup());
        Map<String, Object> clinics = new LinkedHashMap<>();
        observations.getClinicDirectory().forEach((key, entry) -> clinics.put(key, entryTree(entry)));
        tree.put("clinic_directory", clinics);
        ObservationSummary summary = observations.summary();
        Map<String, Object> summaryTree = new LinkedHashMap<>();
        summaryTree.put("documents", summary.documentsAbsorbed());
        summaryTree.put("total_entities", summary.totalEntities());
        summaryTree.put("by_category", summary.byType());
        summaryTree.put("unique_tins", summary.uniqueTins());
        summaryTree.put("clinic_entries", summary.clinicEntries());
        tree.put("summary", summaryTree);
        return write(tree, "observations");
    }

    private String write(Object tree, String subject) {
        try {
            return writer.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new NetworkExportException("Failed to serialize " + subject + ": " + e.getOriginalMessage(), e);
        }
    }

    // --- records ---

    static Map<String, Object> nodeTree(Node node) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", node.getId());
        tree.put("node_type", node.getKind().getTag());
        tree.put("content", node.getContent());
        tree.put("step_number", node.getStepNumber());
        tree.put("parent_id", node.getParentId());
        tree.put("section", node.getSection());
        tree.put("metadata", node.getMetadata());
        tree.put("entities", node.getEntityIds());
        return tree;
    }

    static Map<String, Object> edgeTree(Edge edge) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", edge.id());
        tree.put("source_id", edge.sourceId());
        tree.put("target_id", edge.targetId());
        tree.put("edge_type", edge.kind().getTag());
        tree.put("condition", edge.condition());
        return tree;
    }

    private static Map<String, Object> versionTree(Version version) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("revision", version.revision());
        tree.put("date", version.date());
        tree.put("description", version.description());
        tree.put("content_hash", version.contentHash());
        return tree;
    }

    private static Map<String, Object> referenceTree(ProcedureReference reference) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("title", reference.getTitle());
        tree.put("status", reference.getStatus().getTag());
        tree.put("depth", reference.getDepth());
        tree.put("source_context", reference.getSourceContext());
        tree.put("linked_root_id", reference.getLinkedRootId());
        tree.put("error", reference.getErrorMessage());
        return tree;
    }

    private static Map<String, Object> entityTree(Entity entity) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", entity.getId());
        tree.put("entity_type", entity.getType().getTag());
        tree.put("value", entity.getValue());
        tree.put("normalized_value", entity.getNormalizedValue());
        tree.put("attributes", entity.getAttributes());
        List<Map<String, Object>> mentions = new ArrayList<>();
        for (EntityMention mention : entity.getMentions()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("section", mention.section());
            m.put("step_number", mention.stepNumber());
            mentions.add(m);
        }
        tree.put("mentions", mentions);
        return tree;
    }

    private static Map<String, Object> tableTree(LookupTable table) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("columns", table.columns());
        tree.put("entries", table.entries().stream().map(NetworkJsonExporter::entryTree).toList());
        return tree;
    }

    private static Map<String, Object> entryTree(LookupEntry entry) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("name", entry.name());
        tree.put("tin", entry.tin());
        tree.put("provider_id", entry.providerId());
        tree.put("npi", entry.npi());
        tree.put("location", entry.location());
        tree.put("cells", entry.cells());
        return tree;
    }
}

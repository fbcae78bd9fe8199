package com.sop.network.resolve;

import com.sop.network.core.model.CategoryKey;
import com.sop.network.core.model.Edge;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.Entity;
import com.sop.network.core.model.LookupTable;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unions the network of a referenced document into a main network.
 *
 * <p>The document's root collapses into one {@link NodeKind#LINKED_ROOT} node;
 * every other node and edge is copied with fresh ids allocated by the main
 * network, and edges are rewritten through the resulting id map. Only then are
 * deep-link edges added from reference pointers to resolved documents. The
 * document network is only read, and a merge that fails part way leaves the
 * main network as it was.</p>
 */
public class GraphMerger {
    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    /**
     * Merges {@code document} into {@code main} under {@code referenceCode}.
     *
     * @param referenceDepth depth of the reference being resolved; codes first seen
     *                       in the document are registered one level deeper
     */
    public MergeResult mergeInto(WorldNetwork main, WorldNetwork document, String referenceCode, int referenceDepth) {
        Objects.requireNonNull(main, "main is required");
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(referenceCode, "referenceCode is required");
        if (document.getRootId() == null) {
            throw new IllegalArgumentException("Document network " + document.getDocumentId() + " has no root");
        }

        try (LogContext ctx = LogContext.forMerge(main.getDocumentId(), referenceCode)) {
            WorldNetwork.Checkpoint checkpoint = main.checkpoint();
            try {
                log.debug("merge.starting code={} documentNodes={} documentEdges={}",
                        referenceCode, document.nodeCount(), document.edgeCount());

                Node linkedRoot = main.addNode(Node.builder(NodeKind.LINKED_ROOT)
                        .content(document.getDocumentName())
                        .metadata(Node.META_REFERENCE_CODE, referenceCode)
                        .metadata("document_id", document.getDocumentId())
                        .metadata("title", document.getMetadata().get("title"))
                        .metadata("document_number", document.getMetadata().get("document_number"))
                        .metadata("current_version", document.getCurrentVersion()));

                Map<String, String> idMap = new LinkedHashMap<>();
                idMap.put(document.getRootId(), linkedRoot.getId());
                copyNodes(main, document, idMap);
                int edgesCopied = copyEdges(main, document, idMap);

                List<String> categoryKeys = registerCategories(main, document, referenceCode, idMap);
                main.linkProcedure(referenceCode, linkedRoot.getId());

                int deepLinks = addDeepLinks(main, referenceCode, linkedRoot.getId(), List.copyOf(idMap.values()));

                for (Entity entity : document.getEntities()) {
                    main.absorbEntity(entity);
                }
                for (LookupTable table : document.getLookupTables().values()) {
                    main.addLookupTable(table.renamed(referenceCode + CategoryKey.SEPARATOR + table.name()));
                }
                List<String> newReferences = registerReferences(main, document, referenceCode, referenceDepth + 1);

                log.info("merge.completed code={} linkedRootId={} nodes={} edges={} deepLinks={} newReferences={}",
                        referenceCode, linkedRoot.getId(), idMap.size(), edgesCopied, deepLinks, newReferences.size());
                return new MergeResult(referenceCode, linkedRoot.getId(), idMap, edgesCopied, deepLinks,
                        categoryKeys, newReferences);
            } catch (RuntimeException e) {
                main.rollbackTo(checkpoint);
                log.warn("merge.rolledBack code={} error={}", referenceCode, e.getMessage());
                throw e;
            }
        }
    }

    private void copyNodes(WorldNetwork main, WorldNetwork document, Map<String, String> idMap) {
        for (Node node : document.getNodes()) {
            if (node.getId().equals(document.getRootId())) {
                continue;
            }
            Node copy = main.addNode(Node.builder(node.getKind())
                    .content(node.getContent())
                    .stepNumber(node.getStepNumber())
                    .parentId(node.getParentId() != null ? idMap.get(node.getParentId()) : null)
                    .section(node.getSection())
                    .metadata(node.getMetadata())
                    .entityIds(node.getEntityIds()));
            idMap.put(node.getId(), copy.getId());
        }
    }

    private int copyEdges(WorldNetwork main, WorldNetwork document, Map<String, String> idMap) {
        int copied = 0;
        for (Edge edge : document.getEdges()) {
            String source = idMap.get(edge.sourceId());
            String target = idMap.get(edge.targetId());
            if (source == null || target == null) {
                log.warn("merge.edgeSkipped edgeId={} source={} target={}", edge.id(), edge.sourceId(), edge.targetId());
                continue;
            }
            main.addEdge(source, target, edge.kind(), edge.condition());
            copied++;
        }
        return copied;
    }

    private List<String> registerCategories(WorldNetwork main, WorldNetwork document, String referenceCode,
                                            Map<String, String> idMap) {
        List<String> keys = new ArrayList<>();
        document.getCategoryRoots().forEach((key, nodeId) -> {
            CategoryKey namespaced = key.namespacedUnder(referenceCode);
            if (main.getCategoryRoots().containsKey(namespaced)) {
                log.warn("merge.categoryExists key={}", namespaced.toKey());
                return;
            }
            main.registerCategory(namespaced, idMap.get(nodeId));
            keys.add(namespaced.toKey());
        });
        return keys;
    }

    /**
     * Links every pointer at {@code referenceCode} to the new linked root, and every copied
     * pointer at an already resolved code to that code's linked root.
     */
    private int addDeepLinks(WorldNetwork main, String referenceCode, String linkedRootId, List<String> copiedIds) {
        int added = 0;
        for (Node pointer : main.findReferenceNodes(referenceCode)) {
            main.addEdge(pointer.getId(), linkedRootId, EdgeKind.DEEP_LINK);
            added++;
        }
        for (String copiedId : copiedIds) {
            Node node = main.getNode(copiedId).orElseThrow();
            if (node.getKind() != NodeKind.REFERENCE) {
                continue;
            }
            Object code = node.getMetadata(Node.META_REFERENCE_CODE);
            if (code == null || referenceCode.equals(code)) {
                continue;
            }
            String target = main.getLinkedProcedures().get(code.toString());
            if (target != null) {
                main.addEdge(node.getId(), target, EdgeKind.DEEP_LINK);
                added++;
            }
        }
        return added;
    }

    private List<String> registerReferences(WorldNetwork main, WorldNetwork document, String referenceCode,
                                            int depth) {
        List<String> newCodes = new ArrayList<>();
        for (ProcedureReference reference : document.getReferences()) {
            if (main.hasReference(reference.getCode())) {
                main.getReference(reference.getCode()).ifPresent(r -> r.offerTitle(reference.getTitle()));
                continue;
            }
            main.registerReference(reference.getCode(), reference.getTitle(),
                    referenceCode + ": " + reference.getSourceContext(), depth);
            newCodes.add(reference.getCode());
        }
        return newCodes;
    }
}

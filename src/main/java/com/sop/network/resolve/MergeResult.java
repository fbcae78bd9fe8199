package com.sop.network.resolve;

import java.util.List;
import java.util.Map;

/**
 * Result of merging a referenced document into a network.
 *
 * @param referenceCode  code the document was merged under
 * @param linkedRootId   id of the linked root node standing in for the document's root
 * @param nodeIdMap      document node id to main network node id, root included
 * @param edgesCopied    number of document edges copied
 * @param deepLinksAdded number of deep-link edges added
 * @param categoryKeys   namespaced category keys registered
 * @param newReferences  codes first seen in the document and registered as pending
 */
public record MergeResult(String referenceCode, String linkedRootId, Map<String, String> nodeIdMap,
                          int edgesCopied, int deepLinksAdded, List<String> categoryKeys,
                          List<String> newReferences) {

    public MergeResult {
        nodeIdMap = nodeIdMap != null ? Map.copyOf(nodeIdMap) : Map.of();
        categoryKeys = categoryKeys != null ? List.copyOf(categoryKeys) : List.of();
        newReferences = newReferences != null ? List.copyOf(newReferences) : List.of();
    }

    /**
     * Nodes created in the main network, the linked root included.
     */
    public int nodesCopied() {
        return nodeIdMap.size();
    }
}

package com.sop.network.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts over a finished network. Map iteration order is stable.
 *
 * @param totalNodes         number of nodes
 * @param totalEdges         number of edges
 * @param nodesByKind        node count per kind tag
 * @param edgesByKind        edge count per kind tag
 * @param referencesByStatus reference count per status tag, every status present
 * @param categoryMaxDepths  longest root-to-leaf depth per category key
 * @param decisionPoints     number of decision nodes
 * @param entityCount        number of entities
 * @param versionCount       number of revision rows
 * @param currentVersion     first revision, or null
 * @param categories         category keys in registration order
 * @param lookupTableSizes   entry count per lookup table
 * @param linkedProcedures   number of resolved reference codes
 */
public record NetworkStatistics(int totalNodes, int totalEdges,
                                Map<String, Integer> nodesByKind,
                                Map<String, Integer> edgesByKind,
                                Map<String, Integer> referencesByStatus,
                                Map<String, Integer> categoryMaxDepths,
                                int decisionPoints, int entityCount, int versionCount,
                                String currentVersion, List<String> categories,
                                Map<String, Integer> lookupTableSizes, int linkedProcedures) {

    public NetworkStatistics {
        nodesByKind = frozen(nodesByKind);
        edgesByKind = frozen(edgesByKind);
        referencesByStatus = frozen(referencesByStatus);
        categoryMaxDepths = frozen(categoryMaxDepths);
        lookupTableSizes = frozen(lookupTableSizes);
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    public int referenceCount(String statusTag) {
        return referencesByStatus.getOrDefault(statusTag, 0);
    }

    private static Map<String, Integer> frozen(Map<String, Integer> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}

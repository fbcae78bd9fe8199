package com.sop.network.query;

import com.sop.network.core.model.Edge;
import com.sop.network.core.model.Node;

import java.util.List;

/**
 * Nodes and edges reachable from one root, in traversal order.
 *
 * @param key    category key or reference code the subgraph was requested for
 * @param rootId id of the node the traversal started from
 * @param nodes  reached nodes, root first
 * @param edges  edges between reached nodes that the traversal followed
 */
public record NetworkSubgraph(String key, String rootId, List<Node> nodes, List<Edge> edges) {

    public NetworkSubgraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public boolean containsNode(String nodeId) {
        return nodes.stream().anyMatch(n -> n.getId().equals(nodeId));
    }
}

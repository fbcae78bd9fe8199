package com.sop.network.query;

import com.sop.network.core.model.Edge;
import com.sop.network.core.model.EdgeKind;
import com.sop.network.core.model.LookupTable;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.ProcedureReference;
import com.sop.network.core.model.ReferenceStatus;
import com.sop.network.core.model.WorldNetwork;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only queries over a {@link WorldNetwork}.
 *
 * <p>Traversals track visited ids, so they terminate on any graph, including
 * networks whose linked documents reference each other. By default they follow
 * every outgoing edge, deep links and proceed-to-section jumps included; pass
 * {@code followLinks = false} to stay on the structural edges of one document.</p>
 */
public class NetworkQueryService {

    private final WorldNetwork network;

    public NetworkQueryService(WorldNetwork network) {
        this.network = Objects.requireNonNull(network, "network is required");
    }

    // --- subgraphs ---

    /**
     * Subgraph of a category ({@code name} or {@code code/name}) or of a resolved
     * reference code, including every linked procedure reachable from it.
     */
    public Optional<NetworkSubgraph> subgraphFor(String key) {
        return subgraphFor(key, true);
    }

    public Optional<NetworkSubgraph> subgraphFor(String key, boolean followLinks) {
        if (key == null) {
            return Optional.empty();
        }
        Optional<String> rootId = network.findCategoryRoot(key)
                .or(() -> Optional.ofNullable(network.getLinkedProcedures().get(key)));
        return rootId.map(id -> traverse(key, id, followLinks));
    }

    /**
     * Subgraph reachable from an arbitrary node.
     */
    public Optional<NetworkSubgraph> subgraphFrom(String nodeId, boolean followLinks) {
        return network.getNode(nodeId).map(n -> traverse(nodeId, nodeId, followLinks));
    }

    private NetworkSubgraph traverse(String key, String rootId, boolean followLinks) {
        Set<String> visited = new LinkedHashSet<>();
        List<Edge> edges = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(rootId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            List<Edge> outgoing = followed(current, followLinks);
            edges.addAll(outgoing);
            for (int i = outgoing.size() - 1; i >= 0; i--) {
                String target = outgoing.get(i).targetId();
                if (!visited.contains(target)) {
                    stack.push(target);
                }
            }
        }
        List<Node> nodes = visited.stream()
                .map(id -> network.getNode(id).orElseThrow())
                .toList();
        return new NetworkSubgraph(key, rootId, nodes, edges);
    }

    private List<Edge> followed(String nodeId, boolean followLinks) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : network.getOutgoingEdges(nodeId)) {
            if (followLinks || isStructural(edge.kind())) {
                result.add(edge);
            }
        }
        return result;
    }

    static boolean isStructural(EdgeKind kind) {
        return switch (kind) {
            case SEQUENCE, CONDITION_YES, CONDITION_NO, CONDITION_UNSURE,
                    NESTED_YES, NESTED_NO, NESTED_CONDITION, CONTAINS, REFERENCE -> true;
            case DEEP_LINK, PROCEED_TO_SECTION -> false;
        };
    }

    // --- path evaluation ---

    /**
     * Walks the decision flow from a node given answered conditions keyed
     * {@code nodeId + "_" + label}, e.g. {@code node_0003_YES}.
     *
     * <p>A decision follows its first outgoing condition answered {@code true} and
     * halts when none is. Other nodes first follow an answered nested condition,
     * then a branch marked "continue to next step" jumps to its decision's
     * successor, then a sequence edge is followed. A node already on the path
     * ends the walk.</p>
     *
     * @return visited node ids in order, empty if the start node is unknown
     */
    public List<String> evaluatePath(String startNodeId, Map<String, Boolean> answeredConditions) {
        Map<String, Boolean> answers = answeredConditions != null ? answeredConditions : Map.of();
        List<String> path = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = network.getNode(startNodeId).isPresent() ? startNodeId : null;
        while (current != null && seen.add(current)) {
            path.add(current);
            current = nextOnPath(network.getNode(current).orElseThrow(), answers).orElse(null);
        }
        return path;
    }

    private Optional<String> nextOnPath(Node node, Map<String, Boolean> answers) {
        Optional<String> answered = firstAnswered(node.getId(), answers);
        if (node.getKind() == NodeKind.DECISION || answered.isPresent()) {
            return answered;
        }
        if (node.getKind().isBranch() && node.hasFlag(Node.META_CONTINUE_TO_STEP)) {
            return sequenceSuccessor(node.getParentId());
        }
        return sequenceSuccessor(node.getId());
    }

    private Optional<String> firstAnswered(String nodeId, Map<String, Boolean> answers) {
        return network.getOutgoingEdges(nodeId).stream()
                .filter(e -> e.kind().isConditional() && e.hasCondition())
                .filter(e -> Boolean.TRUE.equals(answers.get(nodeId + "_" + e.condition())))
                .map(Edge::targetId)
                .findFirst();
    }

    private Optional<String> sequenceSuccessor(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return network.getOutgoingEdges(nodeId).stream()
                .filter(e -> e.kind() == EdgeKind.SEQUENCE)
                .map(Edge::targetId)
                .findFirst();
    }

    // --- statistics ---

    public NetworkStatistics statistics() {
        Map<String, Integer> nodesByKind = new LinkedHashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            int count = (int) network.getNodes().stream().filter(n -> n.getKind() == kind).count();
            if (count > 0) {
                nodesByKind.put(kind.getTag(), count);
            }
        }
        Map<String, Integer> edgesByKind = new LinkedHashMap<>();
        for (EdgeKind kind : EdgeKind.values()) {
            int count = (int) network.getEdges().stream().filter(e -> e.kind() == kind).count();
            if (count > 0) {
                edgesByKind.put(kind.getTag(), count);
            }
        }
        Map<String, Integer> referencesByStatus = new LinkedHashMap<>();
        for (ReferenceStatus status : ReferenceStatus.values()) {
            referencesByStatus.put(status.getTag(), 0);
        }
        for (ProcedureReference reference : network.getReferences()) {
            referencesByStatus.merge(reference.getStatus().getTag(), 1, Integer::sum);
        }
        Map<String, Integer> depths = new LinkedHashMap<>();
        network.getClaimTypeRoots().forEach((key, nodeId) -> depths.put(key, maxDepthFrom(nodeId)));
        Map<String, Integer> tableSizes = new LinkedHashMap<>();
        for (LookupTable table : network.getLookupTables().values()) {
            tableSizes.put(table.name(), table.entries().size());
        }

        return new NetworkStatistics(
                network.nodeCount(),
                network.edgeCount(),
                nodesByKind,
                edgesByKind,
                referencesByStatus,
                depths,
                nodesByKind.getOrDefault(NodeKind.DECISION.getTag(), 0),
                network.getEntities().size(),
                network.getVersions().size(),
                network.getCurrentVersion(),
                List.copyOf(network.getClaimTypeRoots().keySet()),
                tableSizes,
                network.getLinkedProcedures().size());
    }

    /**
     * Longest chain of edges below a node, linked procedures included, each node counted once.
     */
    public int maxDepthFrom(String nodeId) {
        if (network.getNode(nodeId).isEmpty()) {
            return 0;
        }
        int max = 0;
        Set<String> visited = new HashSet<>();
        Deque<Map.Entry<String, Integer>> stack = new ArrayDeque<>();
        stack.push(Map.entry(nodeId, 0));
        while (!stack.isEmpty()) {
            Map.Entry<String, Integer> entry = stack.pop();
            if (!visited.add(entry.getKey())) {
                continue;
            }
            max = Math.max(max, entry.getValue());
            for (Edge edge : followed(entry.getKey(), true)) {
                if (!visited.contains(edge.targetId())) {
                    stack.push(Map.entry(edge.targetId(), entry.getValue() + 1));
                }
            }
        }
        return max;
    }
}

package com.sop.network.core.model;

import java.util.Objects;

/**
 * Directed edge between two node ids of the same {@link WorldNetwork}.
 *
 * @param id        edge id, unique within the network
 * @param sourceId  id of the source node
 * @param targetId  id of the target node
 * @param kind      relationship kind
 * @param condition optional condition label, e.g. {@code YES}
 */
public record Edge(String id, String sourceId, String targetId, EdgeKind kind, String condition) {

    public Edge {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}

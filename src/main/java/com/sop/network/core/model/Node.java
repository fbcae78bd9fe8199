package com.sop.network.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A vertex of a {@link WorldNetwork}.
 * Nodes are created once by the network and never change afterwards, except
 * that entity ids may be appended while text is being scanned.
 */
public class Node {

    public static final String META_NOTES = "notes";
    public static final String META_RAW = "raw_text";
    public static final String META_SCENARIO = "scenario_type";
    public static final String META_CONDITION = "condition";
    public static final String META_REFERENCE_CODE = "reference_code";
    public static final String META_CONTINUE_TO_STEP = "continue_to_step";
    public static final String META_PROCEED_TO_SECTION = "proceed_to_section";
    public static final String META_PROCEDURE_REFS = "procedure_refs";
    public static final String META_IS_DECISION = "is_decision";

    private final String id;
    private final NodeKind kind;
    private final String content;
    private final Integer stepNumber;
    private final String parentId;
    private final String section;
    private final Map<String, Object> metadata;
    private final List<String> entityIds;

    private Node(String id, Builder builder) {
        this.id = id;
        this.kind = builder.kind;
        this.content = builder.content != null ? builder.content : "";
        this.stepNumber = builder.stepNumber;
        this.parentId = builder.parentId;
        this.section = builder.section;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.entityIds = new ArrayList<>(builder.entityIds);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public Integer getStepNumber() {
        return stepNumber;
    }

    public String getParentId() {
        return parentId;
    }

    public String getSection() {
        return section;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public boolean hasFlag(String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }

    public List<String> getEntityIds() {
        return Collections.unmodifiableList(entityIds);
    }

    void addEntityId(String entityId) {
        if (!entityIds.contains(entityId)) {
            entityIds.add(entityId);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", content='" + (content.length() > 40 ? content.substring(0, 40) + "..." : content) + '\'' +
                '}';
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /**
     * Collects node attributes. The id is assigned by {@link WorldNetwork#addNode(Builder)}.
     */
    public static class Builder {
        private final NodeKind kind;
        private String content;
        private Integer stepNumber;
        private String parentId;
        private String section;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<String> entityIds = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind is required");
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder stepNumber(Integer stepNumber) {
            this.stepNumber = stepNumber;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        /**
         * Adds a metadata entry; null values are skipped.
         */
        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::metadata);
            }
            return this;
        }

        public Builder entityIds(List<String> ids) {
            if (ids != null) {
                ids.stream().filter(id -> !entityIds.contains(id)).forEach(entityIds::add);
            }
            return this;
        }

        Node build(String id) {
            return new Node(id, this);
        }
    }
}

package com.sop.network.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A deduplicated domain identifier extracted from procedure text.
 * Identity is derived from (type, normalized value), so extracting the same
 * value again always lands on the same entity. Entities are never removed;
 * repeated sightings only append mentions.
 */
public class Entity {
    private final String id;
    private final EntityType type;
    private final String value;
    private final String normalizedValue;
    private final Map<String, Object> attributes;
    private final List<EntityMention> mentions;

    private Entity(Builder builder) {
        this.type = builder.type;
        this.value = builder.value;
        this.normalizedValue = builder.normalizedValue;
        this.id = type.entityId(normalizedValue);
        this.attributes = new LinkedHashMap<>(builder.attributes);
        this.mentions = new ArrayList<>(builder.mentions);
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    /**
     * The value as first seen in the text.
     */
    public String getValue() {
        return value;
    }

    public String getNormalizedValue() {
        return normalizedValue;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<EntityMention> getMentions() {
        return Collections.unmodifiableList(mentions);
    }

    public void addMention(EntityMention mention) {
        mentions.add(Objects.requireNonNull(mention, "mention is required"));
    }

    public void addMentions(List<EntityMention> more) {
        more.forEach(this::addMention);
    }

    void truncateMentions(int size) {
        if (size < mentions.size()) {
            mentions.subList(size, mentions.size()).clear();
        }
    }

    /**
     * Adds an attribute unless one with the same key already exists.
     */
    public void putAttributeIfAbsent(String key, Object attributeValue) {
        attributes.putIfAbsent(key, attributeValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", value='" + value + '\'' +
                ", mentions=" + mentions.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityType type;
        private String value;
        private String normalizedValue;
        private Map<String, Object> attributes = Map.of();
        private List<EntityMention> mentions = List.of();

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder normalizedValue(String normalizedValue) {
            this.normalizedValue = normalizedValue;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes != null ? attributes : Map.of();
            return this;
        }

        public Builder mentions(List<EntityMention> mentions) {
            this.mentions = mentions != null ? mentions : List.of();
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(normalizedValue, "normalizedValue is required");
            if (value == null) {
                value = normalizedValue;
            }
            return new Entity(this);
        }
    }
}

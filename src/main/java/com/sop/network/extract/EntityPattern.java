package com.sop.network.extract;

import com.sop.network.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A regex recognizer for one class of domain identifier.
 * Patterns have priority ordering; the captured group is normalized before it is keyed.
 */
public class EntityPattern {

    /**
     * Upper-cases the value and strips whitespace and dashes.
     */
    public static final UnaryOperator<String> COMPACT_UPPER =
            value -> value.replaceAll("[\\s\\-–]", "").toUpperCase(Locale.ROOT);

    /**
     * Lower-cases the value and joins words with underscores.
     */
    public static final UnaryOperator<String> SLUG_LOWER =
            value -> value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-–]+", "_");

    /**
     * Upper-cases the value and joins words with underscores.
     */
    public static final UnaryOperator<String> SLUG_UPPER =
            value -> value.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-–]+", "_");

    private final String name;
    private final EntityType type;
    private final Pattern pattern;
    private final int group;
    private final UnaryOperator<String> normalizer;
    private final int priority;

    private EntityPattern(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.pattern = builder.caseInsensitive
                ? Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE)
                : Pattern.compile(builder.pattern);
        this.group = builder.group;
        this.normalizer = builder.normalizer;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public EntityType getType() {
        return type;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Normalizes a raw captured value.
     */
    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return normalizer.apply(raw.trim());
    }

    /**
     * Returns every match in the text, in order of appearance.
     */
    public List<ExtractedEntity> findAll(String text) {
        List<ExtractedEntity> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(group);
            if (raw == null) {
                continue;
            }
            String normalized = normalize(raw);
            if (!normalized.isEmpty()) {
                result.add(new ExtractedEntity(type, raw.trim(), normalized, matcher.start(group)));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityPattern that = (EntityPattern) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "EntityPattern{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private EntityType type;
        private String pattern;
        private boolean caseInsensitive;
        private int group = 0;
        private UnaryOperator<String> normalizer = COMPACT_UPPER;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder caseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        /**
         * Capture group holding the value; 0 takes the whole match.
         */
        public Builder group(int group) {
            this.group = group;
            return this;
        }

        public Builder normalizer(UnaryOperator<String> normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public EntityPattern build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(normalizer, "normalizer is required");
            if (group < 0) {
                throw new IllegalArgumentException("group must be >= 0");
            }
            return new EntityPattern(this);
        }
    }
}

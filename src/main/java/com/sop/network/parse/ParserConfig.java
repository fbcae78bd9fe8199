package com.sop.network.parse;

import com.sop.network.extract.DefaultEntityPatterns;
import com.sop.network.extract.EntityPattern;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings for {@link StructuralParser}.
 */
public class ParserConfig {

    public static final String DEFAULT_REFERENCE_PREFIX = "PR.OP.CL.";
    private static final int DEFAULT_STEP_EXCERPT_LIMIT = 1000;
    private static final int DEFAULT_ACTION_EXCERPT_LIMIT = 500;

    /**
     * Bold and plain level-3 headings. The first group is the category name.
     */
    public static final List<String> DEFAULT_CATEGORY_HEADINGS = List.of(
            "^###\\s+\\*\\*(.+?)\\*\\*\\s*$",
            "^###\\s+([^*\\s].*?)\\s*$"
    );

    public static final String DEFAULT_START_MARKER = "^#{1,3}\\s+\\**_?Action Required_?\\**\\s*$";

    private final String referencePrefix;
    private final Pattern referencePattern;
    private final List<Pattern> categoryHeadings;
    private final Pattern startMarker;
    private final List<String> skippedCategoryWords;
    private final int stepExcerptLimit;
    private final int actionExcerptLimit;
    private final List<EntityPattern> entityPatterns;

    private ParserConfig(Builder builder) {
        this.referencePrefix = builder.referencePrefix;
        this.referencePattern = Pattern.compile(
                "(" + Pattern.quote(builder.referencePrefix) + "\\d+)(?:\\s*[-–]\\s*([^.\\n]+))?",
                Pattern.CASE_INSENSITIVE);
        this.categoryHeadings = builder.categoryHeadings.stream()
                .map(Pattern::compile)
                .toList();
        this.startMarker = builder.startMarker != null
                ? Pattern.compile(builder.startMarker, Pattern.MULTILINE | Pattern.CASE_INSENSITIVE)
                : null;
        this.skippedCategoryWords = List.copyOf(builder.skippedCategoryWords);
        this.stepExcerptLimit = builder.stepExcerptLimit;
        this.actionExcerptLimit = builder.actionExcerptLimit;
        this.entityPatterns = List.copyOf(builder.entityPatterns);
    }

    public String getReferencePrefix() {
        return referencePrefix;
    }

    /**
     * Pattern for reference codes: group 1 is the code, group 2 the optional title after a dash.
     */
    public Pattern getReferencePattern() {
        return referencePattern;
    }

    public List<Pattern> getCategoryHeadings() {
        return categoryHeadings;
    }

    /**
     * Heading after which category search begins, or null to search the whole text.
     */
    public Pattern getStartMarker() {
        return startMarker;
    }

    public List<String> getSkippedCategoryWords() {
        return skippedCategoryWords;
    }

    public int getStepExcerptLimit() {
        return stepExcerptLimit;
    }

    public int getActionExcerptLimit() {
        return actionExcerptLimit;
    }

    public List<EntityPattern> getEntityPatterns() {
        return entityPatterns;
    }

    public static ParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String referencePrefix = DEFAULT_REFERENCE_PREFIX;
        private List<String> categoryHeadings = DEFAULT_CATEGORY_HEADINGS;
        private String startMarker = DEFAULT_START_MARKER;
        private List<String> skippedCategoryWords = List.of("Overview");
        private int stepExcerptLimit = DEFAULT_STEP_EXCERPT_LIMIT;
        private int actionExcerptLimit = DEFAULT_ACTION_EXCERPT_LIMIT;
        private List<EntityPattern> entityPatterns = DefaultEntityPatterns.getAll();

        public Builder referencePrefix(String referencePrefix) {
            if (referencePrefix == null || referencePrefix.isBlank()) {
                throw new IllegalArgumentException("referencePrefix must not be blank");
            }
            this.referencePrefix = referencePrefix;
            return this;
        }

        /**
         * Replaces the category heading patterns. Each must capture the name in group 1.
         */
        public Builder categoryHeadings(List<String> categoryHeadings) {
            this.categoryHeadings = List.copyOf(categoryHeadings);
            return this;
        }

        public Builder startMarker(String startMarker) {
            this.startMarker = startMarker;
            return this;
        }

        public Builder skippedCategoryWords(List<String> skippedCategoryWords) {
            this.skippedCategoryWords = List.copyOf(skippedCategoryWords);
            return this;
        }

        public Builder stepExcerptLimit(int stepExcerptLimit) {
            if (stepExcerptLimit <= 0) {
                throw new IllegalArgumentException("stepExcerptLimit must be positive");
            }
            this.stepExcerptLimit = stepExcerptLimit;
            return this;
        }

        public Builder actionExcerptLimit(int actionExcerptLimit) {
            if (actionExcerptLimit <= 0) {
                throw new IllegalArgumentException("actionExcerptLimit must be positive");
            }
            this.actionExcerptLimit = actionExcerptLimit;
            return this;
        }

        public Builder entityPatterns(List<EntityPattern> entityPatterns) {
            this.entityPatterns = Objects.requireNonNull(entityPatterns, "entityPatterns is required");
            return this;
        }

        public ParserConfig build() {
            if (categoryHeadings.isEmpty()) {
                throw new IllegalArgumentException("at least one category heading pattern is required");
            }
            return new ParserConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ParserConfig{" +
                "referencePrefix='" + referencePrefix + '\'' +
                ", categoryHeadings=" + categoryHeadings.size() +
                ", skippedCategoryWords=" + skippedCategoryWords +
                ", stepExcerptLimit=" + stepExcerptLimit +
                ", actionExcerptLimit=" + actionExcerptLimit +
                '}';
    }
}

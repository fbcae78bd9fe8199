package com.sop.network.extract;

import com.sop.network.core.model.EntityType;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in recognizers for the identifiers that appear in claims procedures.
 */
public final class DefaultEntityPatterns {

    /**
     * Provider organisations recognized by name.
     */
    public static final List<String> PROVIDER_NAMES = List.of(
            "Vita Health", "Concentra", "Crossover", "MedAire", "Omada",
            "Physera", "Kabafusion", "Progyny", "98POINT6", "VSP Retail",
            "UPMC", "Regenexx", "Care Medical", "Crossover Health"
    );

    private DefaultEntityPatterns() {
        // Utility class
    }

    /**
     * Creates an extractor with all default patterns.
     */
    public static EntityExtractor createDefaultExtractor() {
        return new EntityExtractor(getAll());
    }

    public static List<EntityPattern> getAll() {
        return List.of(
                providerId(), taxId(), npi(), pendCode(), pcaCode(),
                groupNumber(), message(), providerNames(PROVIDER_NAMES)
        );
    }

    /**
     * 8 to 12 character upper-case token that starts with a letter and contains a digit,
     * e.g. {@code ABC123DEF}.
     */
    public static EntityPattern providerId() {
        return EntityPattern.builder()
                .name("provider-id")
                .type(EntityType.PROVIDER_ID)
                .pattern("\\b(?=[A-Z0-9]{8,12}\\b)(?=[A-Z]*[0-9])[A-Z][A-Z0-9]{7,11}\\b")
                .priority(10)
                .build();
    }

    public static EntityPattern taxId() {
        return EntityPattern.builder()
                .name("tax-id")
                .type(EntityType.TAX_ID)
                .pattern("\\b(?:TIN|tax identification number)[:\\s]*(\\d{9}|\\d{3}-?\\d{2}-?\\d{4})\\b")
                .caseInsensitive(true)
                .group(1)
                .priority(20)
                .build();
    }

    public static EntityPattern npi() {
        return EntityPattern.builder()
                .name("npi")
                .type(EntityType.NPI)
                .pattern("\\bNPI[:#\\s]*(\\d{10})\\b")
                .group(1)
                .priority(20)
                .build();
    }

    public static EntityPattern pendCode() {
        return EntityPattern.builder()
                .name("pend-code")
                .type(EntityType.PEND_CODE)
                .pattern("\\bpend(?:\\s+(?:code|to))?[:\\s]*([A-Z]{1,2}\\d{2,3})\\b")
                .caseInsensitive(true)
                .group(1)
                .priority(30)
                .build();
    }

    public static EntityPattern pcaCode() {
        return EntityPattern.builder()
                .name("pca-code")
                .type(EntityType.PCA_CODE)
                .pattern("\\bPCA[:\\s]*([A-Z]?\\d{3,4})\\b")
                .caseInsensitive(true)
                .group(1)
                .priority(30)
                .build();
    }

    public static EntityPattern groupNumber() {
        return EntityPattern.builder()
                .name("group-number")
                .type(EntityType.GROUP_NUMBER)
                .pattern("\\bgroup(?:\\s+number)?[:#\\s]*(\\d{7})\\b")
                .caseInsensitive(true)
                .group(1)
                .priority(30)
                .build();
    }

    /**
     * Ultra Blue system messages such as {@code Ultra Blue message PCA - DUPLICATE CLAIM.}
     */
    public static EntityPattern message() {
        return EntityPattern.builder()
                .name("ultra-blue-message")
                .type(EntityType.MESSAGE)
                .pattern("Ultra Blue message\\s+([A-Z]{2,4}\\s*[-–]\\s*[A-Z\\s]+?)(?=\\.|,|\\s+on\\b|$)")
                .caseInsensitive(true)
                .group(1)
                .normalizer(EntityPattern.SLUG_UPPER)
                .priority(40)
                .build();
    }

    /**
     * Whole-word match against a fixed vocabulary. Longer names win over their prefixes.
     */
    public static EntityPattern providerNames(List<String> names) {
        String alternation = names.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return EntityPattern.builder()
                .name("provider-name")
                .type(EntityType.PROVIDER_NAME)
                .pattern("\\b(" + alternation + ")\\b")
                .caseInsensitive(true)
                .group(1)
                .normalizer(EntityPattern.SLUG_LOWER)
                .priority(50)
                .build();
    }
}

package com.sop.network.parse;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome markers of a decision step.
 */
public enum BranchKind {
    YES("YES"),
    NO("NO"),
    UNSURE("UNSURE");

    private final String label;

    BranchKind(String label) {
        this.label = label;
    }

    /**
     * Condition label carried by the edge into the branch.
     */
    public String getLabel() {
        return label;
    }

    public static Optional<BranchKind> fromMarker(String marker) {
        if (marker == null) {
            return Optional.empty();
        }
        return switch (marker.trim().toLowerCase(Locale.ROOT)) {
            case "yes" -> Optional.of(YES);
            case "no" -> Optional.of(NO);
            case "unsure" -> Optional.of(UNSURE);
            default -> Optional.empty();
        };
    }
}

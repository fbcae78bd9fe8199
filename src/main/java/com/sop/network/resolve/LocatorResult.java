package com.sop.network.resolve;

import java.util.Objects;

/**
 * Answer of a {@link DocumentLocator}.
 *
 * @param found        whether a document was found
 * @param rawText      document text, null when not found
 * @param source       where the text came from (path, URL), informational
 * @param documentName display name for the document, or null to use its title
 */
public record LocatorResult(boolean found, String rawText, String source, String documentName) {

    private static final LocatorResult NOT_FOUND = new LocatorResult(false, null, null, null);

    public LocatorResult {
        if (found) {
            Objects.requireNonNull(rawText, "rawText is required for a found document");
        }
    }

    public static LocatorResult found(String rawText, String source) {
        return new LocatorResult(true, rawText, source, null);
    }

    public static LocatorResult found(String rawText, String source, String documentName) {
        return new LocatorResult(true, rawText, source, documentName);
    }

    public static LocatorResult notFound() {
        return NOT_FOUND;
    }
}

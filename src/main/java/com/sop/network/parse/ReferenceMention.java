package com.sop.network.parse;

import java.util.Objects;

/**
 * A reference code as found in text, with the title written after it, if any.
 */
public record ReferenceMention(String code, String title) {

    public ReferenceMention {
        Objects.requireNonNull(code, "code is required");
        title = title != null ? title.trim() : "";
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }
}

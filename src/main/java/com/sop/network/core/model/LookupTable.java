package com.sop.network.core.model;

import java.util.List;

/**
 * A pipe-delimited table captured verbatim from a document.
 *
 * @param name    table name derived from the nearest heading
 * @param columns header cells
 * @param entries typed rows
 */
public record LookupTable(String name, List<String> columns, List<LookupEntry> entries) {

    public LookupTable {
        columns = columns != null ? List.copyOf(columns) : List.of();
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public LookupTable renamed(String newName) {
        return new LookupTable(newName, columns, entries);
    }
}

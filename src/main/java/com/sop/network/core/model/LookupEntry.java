package com.sop.network.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed row of a lookup table such as a clinic or provider directory.
 *
 * @param name       first cell, usually the clinic or provider name
 * @param tin        9-digit tax id found in the row, or null
 * @param providerId provider id found in the row, or null
 * @param npi        10-digit NPI found in the row, or null
 * @param location   trailing word of the name (state or city), or null
 * @param cells      raw cells keyed by column header, in column order
 */
public record LookupEntry(String name, String tin, String providerId, String npi,
                          String location, Map<String, String> cells) {

    public LookupEntry {
        cells = cells != null ? Collections.unmodifiableMap(new LinkedHashMap<>(cells)) : Map.of();
    }
}

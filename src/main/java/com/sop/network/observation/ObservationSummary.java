package com.sop.network.observation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts over an {@link ObservationNetwork}.
 *
 * @param documentsAbsorbed number of networks absorbed
 * @param totalEntities     distinct entities across all networks
 * @param byType            entity count per type tag
 * @param uniqueTins        TINs with at least one provider id
 * @param clinicEntries     clinic directory size
 */
public record ObservationSummary(int documentsAbsorbed, int totalEntities, Map<String, Integer> byType,
                                 int uniqueTins, int clinicEntries) {

    public ObservationSummary {
        byType = byType != null ? Collections.unmodifiableMap(new LinkedHashMap<>(byType)) : Map.of();
    }
}

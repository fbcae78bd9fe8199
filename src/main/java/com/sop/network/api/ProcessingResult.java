package com.sop.network.api;

import com.sop.network.core.model.WorldNetwork;
import com.sop.network.parse.StructuralRecord;
import com.sop.network.query.NetworkStatistics;
import com.sop.network.resolve.ResolutionSummary;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing one document.
 *
 * @param record     structural record of the main document
 * @param network    the built, and possibly resolved, network
 * @param resolution resolution summary, or null when no locator is configured
 * @param statistics statistics taken after resolution
 */
public record ProcessingResult(StructuralRecord record, WorldNetwork network,
                               ResolutionSummary resolution, NetworkStatistics statistics) {

    public ProcessingResult {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(network, "network is required");
        Objects.requireNonNull(statistics, "statistics is required");
    }

    public Optional<ResolutionSummary> resolutionSummary() {
        return Optional.ofNullable(resolution);
    }
}

package com.sop.network.resolve;

import java.time.Duration;

/**
 * Outcome counts of one resolution pass.
 *
 * @param attempted        references handed to the locator
 * @param resolved         references merged, or linked to the main root
 * @param notFound         references the locator did not know
 * @param errors           references whose fetch, parse, build or merge failed
 * @param depthLimited     references left pending by the depth limit
 * @param skippedByTimeout references left pending because the time budget ran out
 * @param elapsed          wall time of the pass
 */
public record ResolutionSummary(int attempted, int resolved, int notFound, int errors,
                                int depthLimited, int skippedByTimeout, Duration elapsed) {

    public boolean isComplete() {
        return notFound == 0 && errors == 0 && depthLimited == 0 && skippedByTimeout == 0;
    }
}

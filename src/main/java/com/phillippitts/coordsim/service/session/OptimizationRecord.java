package com.phillippitts.coordsim.service.session;

import java.time.Instant;

/**
 * One application of the result optimization pass.
 *
 * @param confidenceBefore confidence of the compiled result
 * @param confidenceAfter  confidence after enhancement
 * @param appliedAt        when the pass ran
 */
public record OptimizationRecord(double confidenceBefore, double confidenceAfter, Instant appliedAt) {

    public boolean enhanced() {
        return confidenceAfter > confidenceBefore;
    }
}

package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Process-wide expected-loss budget. Built once at start-up and shared read-only.
 *
 * @param maxExpectedLoss largest acceptable expected loss per booking, in currency units
 * @param lgd             loss given default, in (0, 1]
 */
public record RiskConstraints(
    @JsonProperty("maxExpectedLoss") double maxExpectedLoss,
    @JsonProperty("lgd")             double lgd
) {
    public RiskConstraints {
        if (!Double.isFinite(maxExpectedLoss) || maxExpectedLoss <= 0) {
            throw new IllegalArgumentException("maxExpectedLoss must be positive, got " + maxExpectedLoss);
        }
        if (!(lgd > 0.0 && lgd <= 1.0)) {
            throw new IllegalArgumentException("lgd must be within (0, 1], got " + lgd);
        }
    }
}

package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scorer output for one company.
 *
 * <p>All probabilities and scores must lie in [0, 1]. The PD values are expected to be
 * non-decreasing with horizon but this is not enforced. {@code riskCategory} is whatever
 * the scorer reported; the risk gate recomputes it and its answer wins.
 */
public record RiskScores(
    @JsonProperty("intentScore")   double       intentScore,
    @JsonProperty("capacityScore") double       capacityScore,
    @JsonProperty("pd7d")          double       pd7d,
    @JsonProperty("pd14d")         double       pd14d,
    @JsonProperty("pd30d")         double       pd30d,
    @JsonProperty("riskCategory")  RiskCategory riskCategory
) {
    public RiskScores {
        requireUnit("intentScore", intentScore);
        requireUnit("capacityScore", capacityScore);
        requireUnit("pd7d", pd7d);
        requireUnit("pd14d", pd14d);
        requireUnit("pd30d", pd30d);
    }

    public RiskScores(double intentScore, double capacityScore, double pd7d, double pd14d, double pd30d) {
        this(intentScore, capacityScore, pd7d, pd14d, pd30d, null);
    }

    /** Copy with the gate's category stamped on. */
    public RiskScores withCategory(RiskCategory category) {
        return new RiskScores(intentScore, capacityScore, pd7d, pd14d, pd30d, category);
    }

    private static void requireUnit(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }
}

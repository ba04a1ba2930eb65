package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk gate thresholds. Scores between the approve and block intent thresholds,
 * or with capacity under the approve threshold, fall into the yellow band.
 */
public record DecisionMatrix(
    @JsonProperty("blockIntentThreshold")     double blockIntentThreshold,
    @JsonProperty("approveIntentThreshold")   double approveIntentThreshold,
    @JsonProperty("approveCapacityThreshold") double approveCapacityThreshold
) {
    public DecisionMatrix {
        requireUnit("blockIntentThreshold", blockIntentThreshold);
        requireUnit("approveIntentThreshold", approveIntentThreshold);
        requireUnit("approveCapacityThreshold", approveCapacityThreshold);
        if (approveIntentThreshold > blockIntentThreshold) {
            throw new IllegalArgumentException(
                "approveIntentThreshold (" + approveIntentThreshold
                    + ") must not exceed blockIntentThreshold (" + blockIntentThreshold + ")");
        }
    }

    private static void requireUnit(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }
}

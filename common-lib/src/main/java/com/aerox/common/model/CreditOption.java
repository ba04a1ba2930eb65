package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One candidate settlement structure. Produced fresh per request and never mutated;
 * callers only filter or sort them.
 *
 * <p>Construction rejects null kinds and non-finite or negative amounts. Policy limits
 * (settlement window, upfront vs approved, expected-loss budget) are the compliance
 * validator's concern, not the constructor's.
 */
public record CreditOption(
    @JsonProperty("optionId")       String     optionId,
    @JsonProperty("kind")           OptionKind kind,
    @JsonProperty("settlementDays") int        settlementDays,
    @JsonProperty("upfrontAmount")  double     upfrontAmount,
    @JsonProperty("approvedAmount") double     approvedAmount,
    @JsonProperty("expectedLoss")   double     expectedLoss,
    @JsonProperty("frictionScore")  double     frictionScore,
    @JsonProperty("description")    String     description
) implements CreditTerms {

    public CreditOption {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        requireNonNegative("upfrontAmount", upfrontAmount);
        requireNonNegative("approvedAmount", approvedAmount);
        requireNonNegative("expectedLoss", expectedLoss);
        if (!Double.isFinite(frictionScore)) {
            throw new IllegalArgumentException("frictionScore must be finite, got " + frictionScore);
        }
    }

    /** Copy carrying the ordinal label assigned after ranking. */
    public CreditOption withOptionId(String id) {
        return new CreditOption(id, kind, settlementDays, upfrontAmount, approvedAmount,
                                expectedLoss, frictionScore, description);
    }

    @Override
    @JsonIgnore
    public String label() {
        return "Option " + (optionId != null ? optionId : "?");
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(field + " must be a non-negative amount, got " + value);
        }
    }
}

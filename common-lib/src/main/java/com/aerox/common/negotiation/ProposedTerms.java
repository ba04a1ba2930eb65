package com.aerox.common.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured offer as suggested by the narrator. Untrusted: every field may be missing
 * or nonsensical and nothing here is used before {@link CounterOfferCalculator#verify} accepts it.
 */
public record ProposedTerms(
    @JsonProperty("upfront")         Double  upfront,
    @JsonProperty("settlement_days") Integer settlementDays,
    @JsonProperty("approved_amount") Double  approvedAmount
) {}

package com.aerox.common.negotiation;

import com.aerox.common.model.CreditTerms;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A verified counter-offer. {@code expectedLoss} is always the engine's own recomputation,
 * never a figure supplied by the narrator.
 */
public record CounterOffer(
    @JsonProperty("upfrontAmount")  double upfrontAmount,
    @JsonProperty("settlementDays") int    settlementDays,
    @JsonProperty("approvedAmount") double approvedAmount,
    @JsonProperty("expectedLoss")   double expectedLoss,
    @JsonProperty("source")         Source source
) implements CreditTerms {

    public enum Source { NARRATOR, FALLBACK }

    @Override
    @JsonIgnore
    public String label() {
        return "Counter-offer";
    }
}

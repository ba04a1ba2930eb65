package com.aerox.common.negotiation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-facing result of one negotiation exchange.
 * {@code offer} and {@code expectedLoss} are present only when {@code state} is RESOLVED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NegotiationRound(
    @JsonProperty("sessionId")    String           sessionId,
    @JsonProperty("roundNumber")  int              roundNumber,
    @JsonProperty("state")        NegotiationState state,
    @JsonProperty("responseText") String           responseText,
    @JsonProperty("offer")        CounterOffer     offer,
    @JsonProperty("expectedLoss") Double           expectedLoss,
    @JsonProperty("escalate")     boolean          escalate
) {
    public static NegotiationRound resolved(String sessionId, int round, String text, CounterOffer offer) {
        return new NegotiationRound(sessionId, round, NegotiationState.RESOLVED, text, offer,
                                    offer.expectedLoss(), false);
    }

    public static NegotiationRound holding(String sessionId, int round, String text) {
        return new NegotiationRound(sessionId, round, NegotiationState.OPEN, text, null, null, false);
    }

    public static NegotiationRound escalated(String sessionId, int round, String text) {
        return new NegotiationRound(sessionId, round, NegotiationState.ESCALATED, text, null, null, true);
    }
}

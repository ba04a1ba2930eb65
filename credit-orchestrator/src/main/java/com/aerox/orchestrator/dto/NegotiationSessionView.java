package com.aerox.orchestrator.dto;

import com.aerox.common.model.CreditOption;
import com.aerox.common.negotiation.NegotiationSession;
import com.aerox.common.negotiation.NegotiationState;
import com.aerox.common.negotiation.Turn;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Read-only snapshot of a negotiation session. */
public record NegotiationSessionView(
    @JsonProperty("sessionId")      String             sessionId,
    @JsonProperty("companyId")      String             companyId,
    @JsonProperty("roundNumber")    int                roundNumber,
    @JsonProperty("state")          NegotiationState   state,
    @JsonProperty("initialOptions") List<CreditOption> initialOptions,
    @JsonProperty("transcript")     List<Turn>         transcript
) {
    public static NegotiationSessionView of(NegotiationSession session) {
        return new NegotiationSessionView(session.sessionId(), session.booking().companyId(),
                                          session.roundNumber(), session.state(),
                                          session.initialOptions(), session.transcript());
    }
}

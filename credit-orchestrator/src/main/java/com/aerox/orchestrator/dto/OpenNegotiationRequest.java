package com.aerox.orchestrator.dto;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.RiskScores;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OpenNegotiationRequest(
    @JsonProperty("booking")        BookingRequest     booking,
    @JsonProperty("scores")         RiskScores         scores,
    @JsonProperty("initialOptions") List<CreditOption> initialOptions
) {
    public OpenNegotiationRequest {
        if (booking == null) {
            throw new IllegalArgumentException("booking is required");
        }
        if (scores == null) {
            throw new IllegalArgumentException("scores are required");
        }
        initialOptions = initialOptions == null ? List.of() : List.copyOf(initialOptions);
    }
}

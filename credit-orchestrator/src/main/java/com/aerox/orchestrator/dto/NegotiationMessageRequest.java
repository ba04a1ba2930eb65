package com.aerox.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NegotiationMessageRequest(
    @JsonProperty("message") String message
) {
    public NegotiationMessageRequest {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
    }
}

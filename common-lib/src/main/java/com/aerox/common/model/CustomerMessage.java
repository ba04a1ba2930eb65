package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Customer-facing message for a decision: presentation text only, never a source of numbers. */
public record CustomerMessage(
    @JsonProperty("subject")            String       subject,
    @JsonProperty("body")               String       body,
    @JsonProperty("callToActionLabels") List<String> callToActionLabels
) {
    public CustomerMessage {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body is required");
        }
        callToActionLabels = callToActionLabels == null ? List.of() : List.copyOf(callToActionLabels);
    }
}

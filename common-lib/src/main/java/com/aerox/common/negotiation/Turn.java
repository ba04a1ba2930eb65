package com.aerox.common.negotiation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One transcript entry. */
public record Turn(
    @JsonProperty("role") Role   role,
    @JsonProperty("text") String text
) {
    public enum Role { CUSTOMER, AGENT }

    public static Turn customer(String text) {
        return new Turn(Role.CUSTOMER, text);
    }

    public static Turn agent(String text) {
        return new Turn(Role.AGENT, text);
    }
}

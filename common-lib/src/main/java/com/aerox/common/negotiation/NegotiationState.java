package com.aerox.common.negotiation;

/**
 * Negotiation state machine states.
 * ESCALATED is terminal; RESOLVED describes a single round and the session returns to OPEN after it.
 */
public enum NegotiationState {
    OPEN,
    RESOLVED,
    ESCALATED
}

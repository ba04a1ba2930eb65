package com.aerox.common.model;

/** Terminal outcome of processing a booking request. */
public enum Decision {
    APPROVED,
    BLOCKED,
    NEGOTIATE
}

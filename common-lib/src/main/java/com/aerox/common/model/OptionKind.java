package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Credit-term structures the options generator can propose. */
public enum OptionKind {
    SHORTENED_SETTLEMENT,
    UPFRONT_PAYMENT,
    PARTIAL_APPROVAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

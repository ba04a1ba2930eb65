package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of the risk gate.
 * GREEN auto-approves, YELLOW negotiates, RED blocks.
 */
public enum RiskCategory {
    GREEN,
    YELLOW,
    RED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskCategory fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        return RiskCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

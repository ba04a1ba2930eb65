package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationResult(
    @JsonProperty("compliant")    boolean      compliant,
    @JsonProperty("violations")   List<String> violations,
    @JsonProperty("optionsCount") int          optionsCount
) {
    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}

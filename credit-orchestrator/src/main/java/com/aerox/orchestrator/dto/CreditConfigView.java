package com.aerox.orchestrator.dto;

import com.aerox.common.model.DecisionMatrix;
import com.aerox.common.model.RiskConstraints;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Active decision thresholds and risk budget. */
public record CreditConfigView(
    @JsonProperty("decisionMatrix")  DecisionMatrix  decisionMatrix,
    @JsonProperty("riskConstraints") RiskConstraints riskConstraints,
    @JsonProperty("maxRounds")       int             maxRounds
) {}

package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Baseline exposure snapshot for a booking: zero upfront, 30-day horizon.
 * Produced by {@link com.aerox.common.exposure.ExposureCalculator#analyze}.
 */
public record FinancialAnalysis(
    @JsonProperty("totalExposure")        double  totalExposure,
    @JsonProperty("baselineExpectedLoss") double  baselineExpectedLoss,
    @JsonProperty("exceedsRiskAppetite")  boolean exceedsRiskAppetite,
    @JsonProperty("exceedsBy")            double  exceedsBy,

    // ── breakdown ────────────────────────────────────────────────────────────
    @JsonProperty("outstanding")          double  outstanding,
    @JsonProperty("bookingAmount")        double  bookingAmount,
    @JsonProperty("pd30d")                double  pd30d,
    @JsonProperty("lgd")                  double  lgd,
    @JsonProperty("maxExpectedLoss")      double  maxExpectedLoss
) {}

package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Decision record returned for a processed booking.
 *
 * <p>Which optional fields are populated depends on the path taken:
 * <ul>
 *   <li>APPROVED: {@code approvedAmount}, {@code settlementDays}</li>
 *   <li>BLOCKED: {@code reason}; yellow-path blocks also carry the financial analysis,
 *       and a compliance failure carries the rejected options and their validation</li>
 *   <li>NEGOTIATE: financial analysis, options, validation and the customer message</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreditDecision(
    @JsonProperty("traceId")           String             traceId,
    @JsonProperty("decision")          Decision           decision,
    @JsonProperty("riskCategory")      RiskCategory       riskCategory,
    @JsonProperty("scores")            RiskScores         scores,
    @JsonProperty("booking")           BookingRequest     booking,
    @JsonProperty("approvedAmount")    Double             approvedAmount,
    @JsonProperty("settlementDays")    Integer            settlementDays,
    @JsonProperty("financialAnalysis") FinancialAnalysis  financialAnalysis,
    @JsonProperty("options")           List<CreditOption> options,
    @JsonProperty("validation")        ValidationResult   validation,
    @JsonProperty("reason")            String             reason,
    @JsonProperty("message")           CustomerMessage    message
) {
    public static final int STANDARD_SETTLEMENT_DAYS = 30;

    public static CreditDecision approved(String traceId, BookingRequest booking, RiskScores scores) {
        return new CreditDecision(traceId, Decision.APPROVED, RiskCategory.GREEN, scores, booking,
                                  booking.bookingAmount(), STANDARD_SETTLEMENT_DAYS,
                                  null, null, null, null, null);
    }

    public static CreditDecision blocked(String traceId, BookingRequest booking, RiskScores scores,
                                         RiskCategory category, String reason) {
        return new CreditDecision(traceId, Decision.BLOCKED, category, scores, booking,
                                  null, null, null, null, null, reason, null);
    }

    /** Yellow-path block: no option cleared the budget. */
    public static CreditDecision blocked(String traceId, BookingRequest booking, RiskScores scores,
                                         FinancialAnalysis analysis, String reason) {
        return new CreditDecision(traceId, Decision.BLOCKED, RiskCategory.YELLOW, scores, booking,
                                  null, null, analysis, null, null, reason, null);
    }

    /** Yellow-path block: generated options failed the compliance re-check. */
    public static CreditDecision blocked(String traceId, BookingRequest booking, RiskScores scores,
                                         FinancialAnalysis analysis, List<CreditOption> options,
                                         ValidationResult validation) {
        return new CreditDecision(traceId, Decision.BLOCKED, RiskCategory.YELLOW, scores, booking,
                                  null, null, analysis, List.copyOf(options), validation,
                                  "Options failed validation: " + String.join("; ", validation.violations()),
                                  null);
    }

    public static CreditDecision negotiate(String traceId, BookingRequest booking, RiskScores scores,
                                           FinancialAnalysis analysis, List<CreditOption> options,
                                           ValidationResult validation, CustomerMessage message) {
        return new CreditDecision(traceId, Decision.NEGOTIATE, RiskCategory.YELLOW, scores, booking,
                                  null, null, analysis, List.copyOf(options), validation, null, message);
    }
}

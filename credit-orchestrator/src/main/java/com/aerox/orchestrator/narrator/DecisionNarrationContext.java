package com.aerox.orchestrator.narrator;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.FinancialAnalysis;
import com.aerox.common.model.RiskScores;

import java.util.List;

/** What the narrator is told about a yellow-band decision whose options passed compliance. */
public record DecisionNarrationContext(
    String             traceId,
    BookingRequest     booking,
    RiskScores         scores,
    FinancialAnalysis  analysis,
    List<CreditOption> options
) {
    public DecisionNarrationContext {
        options = List.copyOf(options);
    }
}

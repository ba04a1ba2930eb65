package com.aerox.common.exposure;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.FinancialAnalysis;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;

/**
 * Basel-style exposure arithmetic.
 *
 * <pre>
 *   EAD = outstanding + bookingAmount − upfront
 *   EL  = PD × EAD × LGD
 * </pre>
 *
 * <p>Neither function clamps or range-checks its inputs: a negative exposure from an
 * oversized upfront is the caller's error, and PD/LGD ranges are the validator's concern.
 * Stateless and thread-safe.
 */
public final class ExposureCalculator {

    private ExposureCalculator() {}

    public static double exposureAtDefault(double outstanding, double bookingAmount, double upfront) {
        return outstanding + bookingAmount - upfront;
    }

    public static double expectedLoss(double pd, double ead, double lgd) {
        return pd * ead * lgd;
    }

    /**
     * Baseline analysis for a booking: zero upfront, 30-day default probability.
     * {@code exceedsBy} is the only clamped figure; it never goes below zero.
     */
    public static FinancialAnalysis analyze(BookingRequest booking, RiskScores scores,
                                            RiskConstraints constraints) {
        double exposure = exposureAtDefault(booking.currentOutstanding(), booking.bookingAmount(), 0.0);
        double baselineEl = expectedLoss(scores.pd30d(), exposure, constraints.lgd());
        double budget = constraints.maxExpectedLoss();

        return new FinancialAnalysis(
            exposure,
            baselineEl,
            baselineEl > budget,
            Math.max(0.0, baselineEl - budget),
            booking.currentOutstanding(),
            booking.bookingAmount(),
            scores.pd30d(),
            constraints.lgd(),
            budget);
    }
}

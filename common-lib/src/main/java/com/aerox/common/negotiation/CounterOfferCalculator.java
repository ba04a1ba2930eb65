package com.aerox.common.negotiation;

import com.aerox.common.compliance.ComplianceValidator;
import com.aerox.common.exposure.ExposureCalculator;
import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.aerox.common.options.OptionsGenerator;

import java.util.Optional;

/**
 * Verification and deterministic construction of negotiation counter-offers.
 *
 * <p>Narrator suggestions are re-priced here from scratch: the default probability comes from
 * {@link #pdForHorizon}, exposure from the booking, and the result must pass the compliance
 * checks. Nothing the narrator reports about expected loss is read.
 */
public final class CounterOfferCalculator {

    public static final int    FALLBACK_SETTLEMENT_DAYS = 10;
    public static final double FALLBACK_UPFRONT_CAP     = 0.5; // of booking amount

    private CounterOfferCalculator() {}

    /**
     * Conservative default probability for an arbitrary settlement window: the next scored
     * horizon at or above {@code days}, extrapolated linearly from pd30 beyond 30 days.
     */
    public static double pdForHorizon(RiskScores scores, int days) {
        if (days <= 7)  return scores.pd7d();
        if (days <= 14) return scores.pd14d();
        if (days <= 30) return scores.pd30d();
        return Math.min(1.0, scores.pd30d() * days / 30.0);
    }

    /**
     * Re-prices a narrator suggestion.
     *
     * @return the verified offer, or empty when any field is missing, out of range,
     *         or the re-priced terms fail compliance
     */
    public static Optional<CounterOffer> verify(ProposedTerms proposed, BookingRequest booking,
                                                RiskScores scores, RiskConstraints constraints) {
        if (proposed == null || proposed.upfront() == null || proposed.settlementDays() == null) {
            return Optional.empty();
        }
        double upfront = proposed.upfront();
        int days = proposed.settlementDays();
        double approved = proposed.approvedAmount() != null ? proposed.approvedAmount() : booking.bookingAmount();

        if (!Double.isFinite(upfront) || upfront < 0.0) {
            return Optional.empty();
        }
        if (!Double.isFinite(approved) || approved <= 0.0 || approved > booking.bookingAmount()) {
            return Optional.empty();
        }

        double pd = pdForHorizon(scores, days);
        double ead = ExposureCalculator.exposureAtDefault(booking.currentOutstanding(), approved, upfront);
        double el = ExposureCalculator.expectedLoss(pd, ead, constraints.lgd());

        CounterOffer offer = new CounterOffer(upfront, days, approved, el, CounterOffer.Source.NARRATOR);
        if (!ComplianceValidator.violationsOf(offer, constraints.maxExpectedLoss()).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(offer);
    }

    /**
     * Deterministic 10-day offer at the midpoint of the 7- and 14-day default probabilities,
     * with the budget-clearing upfront capped at half the booking.
     *
     * @return the offer, or empty when even the capped upfront leaves the loss over budget
     */
    public static Optional<CounterOffer> fallback(BookingRequest booking, RiskScores scores,
                                                  RiskConstraints constraints) {
        double pd = (scores.pd7d() + scores.pd14d()) / 2.0;
        double exposure = booking.currentOutstanding() + booking.bookingAmount();
        double cap = booking.bookingAmount() * FALLBACK_UPFRONT_CAP;

        double upfront = 0.0;
        if (pd > 0.0) {
            double required = OptionsGenerator.requiredUpfront(exposure, pd, constraints.lgd(),
                                                               constraints.maxExpectedLoss());
            upfront = Math.max(0.0, Math.min(cap, required));
        }

        double el = ExposureCalculator.expectedLoss(pd, exposure - upfront, constraints.lgd());
        CounterOffer offer = new CounterOffer(upfront, FALLBACK_SETTLEMENT_DAYS, booking.bookingAmount(),
                                              el, CounterOffer.Source.FALLBACK);
        if (!ComplianceValidator.violationsOf(offer, constraints.maxExpectedLoss()).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(offer);
    }
}

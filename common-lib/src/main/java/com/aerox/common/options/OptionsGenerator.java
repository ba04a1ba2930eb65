package com.aerox.common.options;

import com.aerox.common.compliance.ComplianceValidator;
import com.aerox.common.exposure.ExposureCalculator;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.OptionKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic generator of alternative credit terms for a yellow-band booking.
 *
 * <h3>Candidate constructions (each admitted only if EL ≤ budget)</h3>
 * <pre>
 *   SHORTENED_SETTLEMENT  7d   pd7  × totalExposure × lgd                     friction 4.0
 *   UPFRONT_PAYMENT       30d  upfront = ⌈E − maxEL / (pd30 × lgd)⌉           friction 7.0
 *                              admitted only if the raw upfront ∈ (0, 1.2 × booking),
 *                              clamped to booking, EL re-checked after clamping
 *   PARTIAL_APPROVAL      14d  pd14 × (outstanding + f × booking) × lgd       friction 8.0 + (1 − f) × 2
 *                              f tried in order 0.5, 0.4, 0.3, 0.2; first clearing f wins
 * </pre>
 *
 * <p>Output is sorted by friction ascending and labelled A, B, C in that order.
 * An empty list is a normal outcome meaning no offer is possible.
 */
public final class OptionsGenerator {

    public static final int    SHORTENED_DAYS            = 7;
    public static final int    UPFRONT_DAYS              = 30;
    public static final int    PARTIAL_DAYS              = 14;
    public static final double UPFRONT_SEARCH_MULTIPLIER = 1.2;

    static final double   SHORTENED_FRICTION     = 4.0;
    static final double   UPFRONT_FRICTION       = 7.0;
    static final double   PARTIAL_BASE_FRICTION  = 8.0;
    static final double[] PARTIAL_FRACTIONS      = {0.5, 0.4, 0.3, 0.2};

    private static final String[] OPTION_IDS = {"A", "B", "C"};

    private OptionsGenerator() {}

    /**
     * Generates up to three budget-clearing options.
     *
     * @param totalExposure   baseline exposure, outstanding + booking
     * @param outstanding     current outstanding balance
     * @param bookingAmount   requested booking amount
     * @param pd7             7-day default probability
     * @param pd14            14-day default probability
     * @param pd30            30-day default probability
     * @param lgd             loss given default
     * @param maxExpectedLoss expected-loss budget
     * @return options ranked by friction, never null
     * @throws IllegalStateException if an admitted option breaks its own structural constraints
     */
    public static List<CreditOption> generate(double totalExposure, double outstanding, double bookingAmount,
                                              double pd7, double pd14, double pd30,
                                              double lgd, double maxExpectedLoss) {
        List<CreditOption> candidates = new ArrayList<>(3);

        CreditOption shortened = shortenedSettlement(totalExposure, bookingAmount, pd7, lgd, maxExpectedLoss);
        if (shortened != null) candidates.add(shortened);

        CreditOption upfront = upfrontPayment(totalExposure, bookingAmount, pd30, lgd, maxExpectedLoss);
        if (upfront != null) candidates.add(upfront);

        CreditOption partial = partialApproval(outstanding, bookingAmount, pd14, lgd, maxExpectedLoss);
        if (partial != null) candidates.add(partial);

        candidates.sort(Comparator.comparingDouble(CreditOption::frictionScore));

        List<CreditOption> ranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size() && i < OPTION_IDS.length; i++) {
            CreditOption option = candidates.get(i).withOptionId(OPTION_IDS[i]);
            assertStructure(option, bookingAmount, maxExpectedLoss);
            ranked.add(option);
        }
        return List.copyOf(ranked);
    }

    /**
     * Minimum whole-unit upfront that brings {@code pd × exposure × lgd} down to the budget.
     * May be zero or negative when the exposure already clears, or infinite when {@code pd} is zero.
     */
    public static double requiredUpfront(double exposure, double pd, double lgd, double maxExpectedLoss) {
        return Math.ceil(exposure - maxExpectedLoss / (pd * lgd));
    }

    // ── candidate constructions ─────────────────────────────────────────────

    private static CreditOption shortenedSettlement(double totalExposure, double bookingAmount,
                                                    double pd7, double lgd, double maxExpectedLoss) {
        double el = ExposureCalculator.expectedLoss(pd7, totalExposure, lgd);
        if (el > maxExpectedLoss) {
            return null;
        }
        return new CreditOption(null, OptionKind.SHORTENED_SETTLEMENT, SHORTENED_DAYS, 0.0, bookingAmount,
                                el, SHORTENED_FRICTION,
                                "Settle in " + SHORTENED_DAYS + " days instead of " + UPFRONT_DAYS);
    }

    private static CreditOption upfrontPayment(double totalExposure, double bookingAmount,
                                               double pd30, double lgd, double maxExpectedLoss) {
        if (pd30 <= 0.0) {
            return null;
        }
        double raw = totalExposure - maxExpectedLoss / (pd30 * lgd);
        if (!(raw > 0.0 && raw < UPFRONT_SEARCH_MULTIPLIER * bookingAmount)) {
            return null;
        }
        double upfront = Math.min(Math.ceil(raw), bookingAmount);
        double ead = totalExposure - upfront;
        double el = ExposureCalculator.expectedLoss(pd30, ead, lgd);
        if (el > maxExpectedLoss) {
            // clamping to the booking amount left the residual exposure over budget
            return null;
        }
        return new CreditOption(null, OptionKind.UPFRONT_PAYMENT, UPFRONT_DAYS, upfront, bookingAmount,
                                el, UPFRONT_FRICTION,
                                "Pay " + money(upfront) + " upfront, settle the balance in " + UPFRONT_DAYS + " days");
    }

    private static CreditOption partialApproval(double outstanding, double bookingAmount,
                                                double pd14, double lgd, double maxExpectedLoss) {
        for (double fraction : PARTIAL_FRACTIONS) {
            double approved = bookingAmount * fraction;
            double ead = ExposureCalculator.exposureAtDefault(outstanding, approved, 0.0);
            double el = ExposureCalculator.expectedLoss(pd14, ead, lgd);
            if (el <= maxExpectedLoss) {
                double friction = PARTIAL_BASE_FRICTION + (1.0 - fraction) * 2.0;
                return new CreditOption(null, OptionKind.PARTIAL_APPROVAL, PARTIAL_DAYS, 0.0, approved,
                                        el, friction,
                                        String.format(Locale.ROOT, "Approve %s now (%d%%), remainder after outstanding clears",
                                                      money(approved), Math.round(fraction * 100)));
            }
        }
        return null;
    }

    // ── invariants ──────────────────────────────────────────────────────────

    private static void assertStructure(CreditOption option, double bookingAmount, double maxExpectedLoss) {
        if (option.expectedLoss() > maxExpectedLoss) {
            throw new IllegalStateException(option.label() + " expected loss " + option.expectedLoss()
                                                + " exceeds budget " + maxExpectedLoss);
        }
        if (option.upfrontAmount() > option.approvedAmount()) {
            throw new IllegalStateException(option.label() + " upfront " + option.upfrontAmount()
                                                + " exceeds approved " + option.approvedAmount());
        }
        if (option.approvedAmount() > bookingAmount) {
            throw new IllegalStateException(option.label() + " approved " + option.approvedAmount()
                                                + " exceeds requested " + bookingAmount);
        }
        if (option.settlementDays() < ComplianceValidator.MIN_SETTLEMENT_DAYS
                || option.settlementDays() > ComplianceValidator.MAX_SETTLEMENT_DAYS) {
            throw new IllegalStateException(option.label() + " settlement days " + option.settlementDays()
                                                + " outside the permitted window");
        }
    }

    /** Whole currency units with US digit grouping, e.g. {@code 47,381}. Shared by every customer-facing text. */
    public static String money(double amount) {
        return String.format(Locale.US, "%,.0f", amount);
    }
}

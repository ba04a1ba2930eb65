package com.aerox.common.compliance;

import com.aerox.common.model.CreditTerms;
import com.aerox.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Independent re-check of offered credit terms.
 *
 * <p>Knows nothing about how the terms were derived. Every item is checked against:
 * <ol>
 *   <li>{@code expectedLoss ≤ maxExpectedLoss}</li>
 *   <li>{@code upfrontAmount ≤ approvedAmount}</li>
 *   <li>{@code 7 ≤ settlementDays ≤ 90}</li>
 * </ol>
 * Violations are reported in item order, checks in the order above.
 */
public final class ComplianceValidator {

    public static final int MIN_SETTLEMENT_DAYS = 7;
    public static final int MAX_SETTLEMENT_DAYS = 90;

    private ComplianceValidator() {}

    public static ValidationResult validate(List<? extends CreditTerms> terms, double maxExpectedLoss) {
        List<String> violations = new ArrayList<>();
        for (CreditTerms item : terms) {
            violations.addAll(violationsOf(item, maxExpectedLoss));
        }
        return new ValidationResult(violations.isEmpty(), violations, terms.size());
    }

    public static List<String> violationsOf(CreditTerms terms, double maxExpectedLoss) {
        List<String> violations = new ArrayList<>(3);
        String label = terms.label();

        if (!(terms.expectedLoss() <= maxExpectedLoss)) {
            violations.add(String.format(Locale.US, "%s: EL %,.2f exceeds %,.2f",
                                         label, terms.expectedLoss(), maxExpectedLoss));
        }
        if (!(terms.upfrontAmount() <= terms.approvedAmount())) {
            violations.add(String.format(Locale.US, "%s: Upfront %,.0f exceeds approved %,.0f",
                                         label, terms.upfrontAmount(), terms.approvedAmount()));
        }
        if (terms.settlementDays() < MIN_SETTLEMENT_DAYS || terms.settlementDays() > MAX_SETTLEMENT_DAYS) {
            violations.add(String.format(Locale.US, "%s: Settlement days %d out of range [%d, %d]",
                                         label, terms.settlementDays(), MIN_SETTLEMENT_DAYS, MAX_SETTLEMENT_DAYS));
        }
        return violations;
    }
}

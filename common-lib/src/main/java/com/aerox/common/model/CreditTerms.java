package com.aerox.common.model;

/**
 * Structural view of anything that may be offered to a customer.
 * The compliance validator checks only what this interface exposes, so it can
 * judge terms it did not produce.
 */
public interface CreditTerms {

    /** Short label used in violation messages, e.g. {@code "Option A"}. */
    String label();

    int settlementDays();

    double upfrontAmount();

    double approvedAmount();

    double expectedLoss();
}

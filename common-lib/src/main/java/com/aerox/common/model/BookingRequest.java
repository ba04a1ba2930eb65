package com.aerox.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A company's request to book travel on credit. Immutable once submitted.
 *
 * <p>Validated on construction: a missing company id or a non-positive booking
 * amount is an input error and never reaches the risk gate.
 */
public record BookingRequest(
    @JsonProperty("companyId")          String    companyId,
    @JsonProperty("companyName")        String    companyName,
    @JsonProperty("bookingAmount")      double    bookingAmount,
    @JsonProperty("currentOutstanding") double    currentOutstanding,
    @JsonProperty("creditLimit")        double    creditLimit,
    @JsonProperty("route")              String    route,
    @JsonProperty("bookingDate")        LocalDate bookingDate
) {
    public BookingRequest {
        if (companyId == null || companyId.isBlank()) {
            throw new IllegalArgumentException("companyId is required");
        }
        if (!Double.isFinite(bookingAmount) || bookingAmount <= 0) {
            throw new IllegalArgumentException("bookingAmount must be a positive amount, got " + bookingAmount);
        }
        if (!Double.isFinite(currentOutstanding) || currentOutstanding < 0) {
            throw new IllegalArgumentException("currentOutstanding must be >= 0, got " + currentOutstanding);
        }
        if (!Double.isFinite(creditLimit) || creditLimit < 0) {
            throw new IllegalArgumentException("creditLimit must be >= 0, got " + creditLimit);
        }
        if (companyName == null || companyName.isBlank()) {
            companyName = companyId;
        }
    }

    /** Amount by which outstanding plus this booking overshoots the credit limit; 0 when within limit. */
    public double creditLimitShortfall() {
        return Math.max(0.0, currentOutstanding + bookingAmount - creditLimit);
    }
}

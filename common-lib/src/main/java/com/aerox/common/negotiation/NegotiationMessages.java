package com.aerox.common.negotiation;

import java.util.Locale;

/** Fixed customer-facing texts used when the narrator is not the source of the reply. */
public final class NegotiationMessages {

    public static final String HOLDING_RESPONSE =
        "I couldn't find terms that fit our risk limits for that request. "
            + "Could you manage a larger upfront payment or a shorter settlement window?";

    private NegotiationMessages() {}

    public static String offerResponse(CounterOffer offer, double maxExpectedLoss) {
        return String.format(Locale.US,
            "I understand. How about ₹%,.0f upfront with %d-day settlement on ₹%,.0f? "
                + "This keeps expected loss at ₹%,.2f, within our limit of ₹%,.0f.",
            offer.upfrontAmount(), offer.settlementDays(), offer.approvedAmount(),
            offer.expectedLoss(), maxExpectedLoss);
    }

    public static String escalationResponse(String reference) {
        return "I've tried multiple combinations but can't find one that fits both your needs and our "
            + "risk limits. I'm escalating this to our senior credit team for manual review. "
            + "They'll contact you within 2 hours. Reference: " + reference;
    }
}

package com.aerox.common.negotiation;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;

import java.util.List;

/**
 * Read-only snapshot handed to the narrator for one round: everything it may use to
 * phrase a response and suggest terms. Built fresh per round from the session.
 */
public record NegotiationContext(
    String             sessionId,
    int                roundNumber,
    BookingRequest     booking,
    RiskScores         scores,
    RiskConstraints    constraints,
    List<CreditOption> initialOptions,
    List<Turn>         transcript,
    String             customerMessage
) {
    public NegotiationContext {
        initialOptions = List.copyOf(initialOptions);
        transcript = List.copyOf(transcript);
    }

    public double totalExposure() {
        return booking.currentOutstanding() + booking.bookingAmount();
    }
}

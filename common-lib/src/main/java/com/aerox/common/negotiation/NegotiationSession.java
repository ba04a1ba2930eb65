package com.aerox.common.negotiation;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.RiskScores;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one customer negotiation.
 *
 * <p>Not thread-safe. The owning store guarantees that at most one round runs against a
 * session at a time; callers outside that store only see snapshots.
 *
 * <h3>Round rules</h3>
 * <ul>
 *   <li>verified offer: round RESOLVED, both turns recorded, round counter advances</li>
 *   <li>no offer before round {@value #MAX_ROUNDS}: holding reply, round counter advances</li>
 *   <li>no offer in round {@value #MAX_ROUNDS}, or any message once all rounds are used: ESCALATED</li>
 *   <li>ESCALATED is terminal; the cached escalation is returned for every later message</li>
 * </ul>
 */
public final class NegotiationSession {

    public static final int MAX_ROUNDS = 3;

    private final String             sessionId;
    private final BookingRequest     booking;
    private final RiskScores         scores;
    private final List<CreditOption> initialOptions;
    private final LocalDate          openedOn;
    private final List<Turn>         transcript = new ArrayList<>();

    private int              roundsCompleted;
    private NegotiationState state = NegotiationState.OPEN;
    private NegotiationRound escalation;

    public NegotiationSession(String sessionId, BookingRequest booking, RiskScores scores,
                              List<CreditOption> initialOptions, LocalDate openedOn) {
        this.sessionId = sessionId;
        this.booking = booking;
        this.scores = scores;
        this.initialOptions = List.copyOf(initialOptions);
        this.openedOn = openedOn;
    }

    public String sessionId()                 { return sessionId; }
    public BookingRequest booking()           { return booking; }
    public RiskScores scores()                { return scores; }
    public List<CreditOption> initialOptions() { return initialOptions; }
    public NegotiationState state()           { return state; }
    public List<Turn> transcript()            { return List.copyOf(transcript); }

    /** Round the next message will be processed in, 1..{@value #MAX_ROUNDS}. */
    public int roundNumber() {
        return Math.min(roundsCompleted + 1, MAX_ROUNDS);
    }

    public boolean isEscalated() {
        return state == NegotiationState.ESCALATED;
    }

    /** True once every round has been used; the next message can only escalate. */
    public boolean isRoundCeilingReached() {
        return roundsCompleted >= MAX_ROUNDS;
    }

    /** Cached escalation result, null until the session escalates. */
    public NegotiationRound escalation() {
        return escalation;
    }

    /**
     * Applies the outcome of one round.
     *
     * @param customerMessage the customer's text for this round
     * @param offer           verified counter-offer, or null when none could be produced
     * @param responseText    reply accompanying {@code offer}; ignored when {@code offer} is null
     */
    public NegotiationRound complete(String customerMessage, CounterOffer offer, String responseText) {
        if (isEscalated()) {
            return escalation;
        }
        if (isRoundCeilingReached()) {
            return escalate(customerMessage);
        }

        int round = roundNumber();
        if (offer != null) {
            record(customerMessage, responseText);
            roundsCompleted++;
            state = NegotiationState.OPEN;
            return NegotiationRound.resolved(sessionId, round, responseText, offer);
        }
        if (round < MAX_ROUNDS) {
            record(customerMessage, NegotiationMessages.HOLDING_RESPONSE);
            roundsCompleted++;
            return NegotiationRound.holding(sessionId, round, NegotiationMessages.HOLDING_RESPONSE);
        }
        return escalate(customerMessage);
    }

    /** Moves the session to ESCALATED, or returns the cached escalation if it already is. */
    public NegotiationRound escalate(String customerMessage) {
        if (isEscalated()) {
            return escalation;
        }
        String text = NegotiationMessages.escalationResponse(escalationReference());
        record(customerMessage, text);
        roundsCompleted = MAX_ROUNDS;
        state = NegotiationState.ESCALATED;
        escalation = NegotiationRound.escalated(sessionId, MAX_ROUNDS, text);
        return escalation;
    }

    /** {@code AERO-<booking date>-<last four characters of the company id>}. */
    public String escalationReference() {
        LocalDate date = booking.bookingDate() != null ? booking.bookingDate() : openedOn;
        String companyId = booking.companyId();
        String suffix = companyId.length() > 4 ? companyId.substring(companyId.length() - 4) : companyId;
        return "AERO-" + date + "-" + suffix;
    }

    private void record(String customerMessage, String agentText) {
        transcript.add(Turn.customer(customerMessage));
        transcript.add(Turn.agent(agentText));
    }
}

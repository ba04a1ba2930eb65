package com.aerox.common.negotiation;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.RiskScores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NegotiationSessionTest {

    private static final BookingRequest BOOKING = new BookingRequest(
        "COMP0042", "Skyline Travels", 50_000, 45_000, 80_000, "DEL-BOM", LocalDate.of(2026, 2, 15));
    private static final RiskScores     SCORES  = new RiskScores(0.32, 0.55, 0.02, 0.08, 0.15);
    private static final CounterOffer   OFFER   =
        new CounterOffer(0, 10, 50_000, 3_325, CounterOffer.Source.FALLBACK);

    private NegotiationSession session;

    @BeforeEach
    void setUp() {
        session = new NegotiationSession("s-1", BOOKING, SCORES, List.of(), LocalDate.of(2026, 3, 1));
    }

    @Test
    @DisplayName("new session is OPEN at round 1 with an empty transcript")
    void initialState() {
        assertEquals(1, session.roundNumber());
        assertEquals(NegotiationState.OPEN, session.state());
        assertTrue(session.transcript().isEmpty());
        assertNull(session.escalation());
    }

    // ── resolved rounds ────────────────────────────────────────────────────

    @Nested
    @DisplayName("verified offer")
    class VerifiedOffer {

        @Test
        @DisplayName("round RESOLVED, turns recorded, round advances, session back to OPEN")
        void resolvesRound() {
            NegotiationRound round = session.complete("Can I pay later?", OFFER, "How about 10 days?");

            assertEquals(NegotiationState.RESOLVED, round.state());
            assertEquals(1, round.roundNumber());
            assertSame(OFFER, round.offer());
            assertEquals(3_325.0, round.expectedLoss());
            assertFalse(round.escalate());

            assertEquals(2, session.roundNumber());
            assertEquals(NegotiationState.OPEN, session.state());
            assertEquals(List.of(Turn.customer("Can I pay later?"), Turn.agent("How about 10 days?")),
                session.transcript());
        }

        @Test
        @DisplayName("round number caps at 3 after three resolved rounds")
        void roundNumberCapped() {
            for (int i = 0; i < 3; i++) {
                session.complete("again", OFFER, "offer");
            }
            assertEquals(3, session.roundNumber());
            assertTrue(session.isRoundCeilingReached());
        }

        @Test
        @DisplayName("message after all rounds are used escalates even with an offer available")
        void afterCeiling_escalates() {
            for (int i = 0; i < 3; i++) {
                session.complete("again", OFFER, "offer");
            }
            NegotiationRound round = session.complete("one more?", OFFER, "offer");

            assertEquals(NegotiationState.ESCALATED, round.state());
            assertTrue(round.escalate());
            assertNull(round.offer());
            assertEquals(3, round.roundNumber());
        }
    }

    // ── failed rounds and escalation ───────────────────────────────────────

    @Nested
    @DisplayName("no offer")
    class NoOffer {

        @Test
        @DisplayName("rounds 1 and 2 give a holding reply and advance")
        void holdingReply() {
            NegotiationRound first = session.complete("no upfront please", null, null);

            assertEquals(NegotiationState.OPEN, first.state());
            assertEquals(1, first.roundNumber());
            assertNull(first.offer());
            assertNull(first.expectedLoss());
            assertFalse(first.escalate());
            assertEquals(NegotiationMessages.HOLDING_RESPONSE, first.responseText());
            assertEquals(2, session.roundNumber());
        }

        @Test
        @DisplayName("round 3 escalates with a booking reference")
        void thirdRoundEscalates() {
            session.complete("no", null, null);
            session.complete("still no", null, null);
            NegotiationRound third = session.complete("final no", null, null);

            assertEquals(NegotiationState.ESCALATED, third.state());
            assertTrue(third.escalate());
            assertNull(third.offer());
            assertNull(third.expectedLoss());
            assertTrue(third.responseText().endsWith("Reference: AERO-2026-02-15-0042"));
            assertTrue(session.isEscalated());
            assertEquals(6, session.transcript().size());
        }

        @Test
        @DisplayName("escalated session re-returns the cached result without recording more turns")
        void escalatedIsTerminal() {
            NegotiationRound escalated = session.escalate("help");
            int turns = session.transcript().size();

            assertSame(escalated, session.complete("hello?", OFFER, "offer"));
            assertSame(escalated, session.escalate("again"));
            assertEquals(turns, session.transcript().size());
            assertEquals(3, session.roundNumber());
        }
    }

    @Nested
    @DisplayName("escalationReference()")
    class EscalationReference {

        @Test
        @DisplayName("uses the booking date and last four characters of the company id")
        void fromBookingDate() {
            assertEquals("AERO-2026-02-15-0042", session.escalationReference());
        }

        @Test
        @DisplayName("falls back to the opening date and a short id as-is")
        void fromOpeningDate() {
            BookingRequest undated = new BookingRequest("C7", null, 1_000, 0, 5_000, null, null);
            NegotiationSession s = new NegotiationSession("s-2", undated, SCORES, List.of(), LocalDate.of(2026, 3, 1));
            assertEquals("AERO-2026-03-01-C7", s.escalationReference());
        }
    }
}

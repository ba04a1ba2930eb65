package com.aerox.common.negotiation;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CounterOfferCalculatorTest {

    private static final RiskConstraints CONSTRAINTS = new RiskConstraints(5_000, 0.70);
    private static final BookingRequest  BOOKING     = new BookingRequest(
        "COMP0042", "Skyline Travels", 50_000, 45_000, 80_000, "DEL-BOM", LocalDate.of(2026, 2, 15));
    private static final RiskScores      SCORES      = new RiskScores(0.32, 0.55, 0.02, 0.08, 0.15);

    // ── pdForHorizon ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("pdForHorizon()")
    class PdForHorizon {

        @Test
        @DisplayName("uses the next scored horizon at or above the window")
        void nextHorizon() {
            assertEquals(0.02, CounterOfferCalculator.pdForHorizon(SCORES, 7));
            assertEquals(0.08, CounterOfferCalculator.pdForHorizon(SCORES, 8));
            assertEquals(0.08, CounterOfferCalculator.pdForHorizon(SCORES, 14));
            assertEquals(0.15, CounterOfferCalculator.pdForHorizon(SCORES, 15));
            assertEquals(0.15, CounterOfferCalculator.pdForHorizon(SCORES, 30));
        }

        @Test
        @DisplayName("beyond 30 days scales pd30 linearly, capped at 1")
        void beyondThirtyDays() {
            assertEquals(0.30, CounterOfferCalculator.pdForHorizon(SCORES, 60), 1e-12);
            RiskScores risky = new RiskScores(0.3, 0.3, 0.4, 0.5, 0.6);
            assertEquals(1.0, CounterOfferCalculator.pdForHorizon(risky, 90));
        }
    }

    // ── verify ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("valid suggestion is re-priced with the engine's own PD")
        void validSuggestion_repriced() {
            Optional<CounterOffer> offer = CounterOfferCalculator.verify(
                new ProposedTerms(20_000.0, 14, 50_000.0), BOOKING, SCORES, CONSTRAINTS);

            assertTrue(offer.isPresent());
            // EAD = 45,000 + 50,000 − 20,000 = 75,000 at pd14 0.08
            assertEquals(4_200.0, offer.get().expectedLoss(), 1e-6);
            assertEquals(CounterOffer.Source.NARRATOR, offer.get().source());
        }

        @Test
        @DisplayName("missing approved amount defaults to the booking amount")
        void approvedDefaultsToBooking() {
            Optional<CounterOffer> offer = CounterOfferCalculator.verify(
                new ProposedTerms(20_000.0, 14, null), BOOKING, SCORES, CONSTRAINTS);
            assertEquals(50_000.0, offer.orElseThrow().approvedAmount());
        }

        @Test
        @DisplayName("reduced approved amount lowers the exposure")
        void reducedApproved() {
            Optional<CounterOffer> offer = CounterOfferCalculator.verify(
                new ProposedTerms(0.0, 30, 2_000.0), BOOKING, SCORES, CONSTRAINTS);
            // 0.15 × 47,000 × 0.7
            assertEquals(4_935.0, offer.orElseThrow().expectedLoss(), 1e-6);
        }

        @Test
        @DisplayName("null or incomplete suggestions are rejected")
        void incomplete_rejected() {
            assertTrue(CounterOfferCalculator.verify(null, BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(null, 14, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(20_000.0, null, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
        }

        @Test
        @DisplayName("out-of-range amounts are rejected")
        void outOfRangeAmounts_rejected() {
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(-1.0, 14, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(Double.NaN, 14, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(20_000.0, 14, 60_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(20_000.0, 14, 0.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
        }

        @Test
        @DisplayName("re-priced loss over budget is rejected")
        void overBudget_rejected() {
            // 0.15 × 95,000 × 0.7 = 9,975
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(0.0, 30, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
        }

        @Test
        @DisplayName("structural violations are rejected even within budget")
        void structuralViolation_rejected() {
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(0.0, 5, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(30_000.0, 14, 20_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
            assertTrue(CounterOfferCalculator.verify(new ProposedTerms(90_000.0, 120, 50_000.0),
                BOOKING, SCORES, CONSTRAINTS).isEmpty());
        }
    }

    // ── fallback ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fallback()")
    class Fallback {

        @Test
        @DisplayName("10 days at the pd7/pd14 midpoint; no upfront needed when already within budget")
        void noUpfrontNeeded() {
            CounterOffer offer = CounterOfferCalculator.fallback(BOOKING, SCORES, CONSTRAINTS).orElseThrow();

            assertEquals(10, offer.settlementDays());
            assertEquals(0.0, offer.upfrontAmount());
            assertEquals(50_000.0, offer.approvedAmount());
            // 0.05 × 95,000 × 0.7
            assertEquals(3_325.0, offer.expectedLoss(), 1e-6);
            assertEquals(CounterOffer.Source.FALLBACK, offer.source());
        }

        @Test
        @DisplayName("solves for a whole-unit upfront that clears the budget")
        void solvedUpfront() {
            RiskScores scores = new RiskScores(0.32, 0.55, 0.06, 0.10, 0.15);
            CounterOffer offer = CounterOfferCalculator.fallback(BOOKING, scores, CONSTRAINTS).orElseThrow();

            // pd 0.08: 95,000 − 5,000 / 0.056 ≈ 5,714.29 → 5,715
            assertEquals(5_715.0, offer.upfrontAmount());
            assertTrue(offer.expectedLoss() <= 5_000.0);
        }

        @Test
        @DisplayName("upfront capped at half the booking; still over budget → no offer")
        void capLeavesLossOverBudget() {
            RiskScores scores = new RiskScores(0.32, 0.55, 0.10, 0.20, 0.30);
            assertTrue(CounterOfferCalculator.fallback(BOOKING, scores, CONSTRAINTS).isEmpty());
        }
    }
}

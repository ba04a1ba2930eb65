package com.aerox.orchestrator.narrator;

import com.aerox.common.exception.CreditEngineException;
import com.aerox.common.exposure.ExposureCalculator;
import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.aerox.common.negotiation.NegotiationContext;
import com.aerox.common.negotiation.Turn;
import com.aerox.common.options.OptionsGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicNarratorTest {

    private static final BookingRequest  BOOKING     = new BookingRequest(
        "COMP0042", "Skyline Travels", 50_000, 45_000, 80_000, "DEL-BOM", LocalDate.of(2026, 2, 15));
    private static final RiskScores      SCORES      = new RiskScores(0.32, 0.55, 0.02, 0.08, 0.15);
    private static final RiskConstraints CONSTRAINTS = new RiskConstraints(5_000, 0.70);

    private AnthropicNarrator narrator;
    private List<CreditOption> options;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        narrator = new AnthropicNarrator(WebClient.builder(), mapper, new NarratorResponseParser(mapper),
                                         "http://localhost:1");
        ReflectionTestUtils.setField(narrator, "anthropicApiKey", "");
        options = OptionsGenerator.generate(95_000, 45_000, 50_000, 0.02, 0.08, 0.15, 0.70, 5_000);
    }

    private DecisionNarrationContext decisionContext() {
        return new DecisionNarrationContext("t-1", BOOKING, SCORES,
                                            ExposureCalculator.analyze(BOOKING, SCORES, CONSTRAINTS), options);
    }

    @Test
    @DisplayName("no API key → error signal, no HTTP call")
    void noApiKey_error() {
        StepVerifier.create(narrator.composeMessage(decisionContext()))
            .expectError(CreditEngineException.class)
            .verify();

        NegotiationContext ctx = new NegotiationContext("s-1", 1, BOOKING, SCORES, CONSTRAINTS, options,
                                                        List.of(), "Too much upfront");
        StepVerifier.create(narrator.proposeCounter(ctx))
            .expectError(CreditEngineException.class)
            .verify();
    }

    @Test
    @DisplayName("decision prompt carries the verified figures and expected labels")
    void messagePrompt() {
        String prompt = narrator.buildMessagePrompt(decisionContext());

        assertTrue(prompt.contains("Skyline Travels"));
        assertTrue(prompt.contains("Exceeds available credit by: ₹15,000"));
        assertTrue(prompt.contains("Pay ₹47,381 upfront"));
        assertTrue(prompt.contains("\"subject\": \"Credit Options for ₹50,000 Booking\""));
        assertTrue(prompt.contains("[\"Select A\",\"Select B\",\"Select C\",\"Support\"]"));
    }

    @Test
    @DisplayName("negotiation prompt carries budget, history and round")
    void negotiationPrompt() {
        NegotiationContext ctx = new NegotiationContext("s-1", 2, BOOKING, SCORES, CONSTRAINTS, options,
            List.of(Turn.customer("Too much upfront"), Turn.agent("How about 10 days?")), "Still too much");

        String prompt = narrator.buildNegotiationPrompt(ctx);

        assertTrue(prompt.contains("Expected loss must not exceed ₹5,000"));
        assertTrue(prompt.contains("Total exposure:   ₹95,000"));
        assertTrue(prompt.contains("Customer: Too much upfront"));
        assertTrue(prompt.contains("Agent: How about 10 days?"));
        assertTrue(prompt.contains("Customer message: Still too much"));
        assertTrue(prompt.contains("Negotiation round: 2 of 3"));
        assertTrue(prompt.contains("Option A: "));
    }
}

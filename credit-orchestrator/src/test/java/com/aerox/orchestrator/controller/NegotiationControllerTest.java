package com.aerox.orchestrator.controller;

import com.aerox.common.model.RiskConstraints;
import com.aerox.common.negotiation.CounterProposal;
import com.aerox.common.negotiation.ProposedTerms;
import com.aerox.orchestrator.dto.NegotiationSessionView;
import com.aerox.orchestrator.logger.CreditFlowLogger;
import com.aerox.orchestrator.narrator.Narrator;
import com.aerox.orchestrator.negotiation.NegotiationEngine;
import com.aerox.orchestrator.negotiation.NegotiationSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NegotiationControllerTest {

    private static final String OPEN_JSON = """
        {"booking": {"companyId": "COMP0042", "companyName": "Skyline Travels", "bookingAmount": 50000,
                     "currentOutstanding": 45000, "creditLimit": 80000, "bookingDate": "2026-02-15"},
         "scores": {"intentScore": 0.32, "capacityScore": 0.55, "pd7d": 0.02, "pd14d": 0.08, "pd30d": 0.15}}
        """;

    private Narrator narrator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        narrator = mock(Narrator.class);
        NegotiationEngine engine = new NegotiationEngine(
            new NegotiationSessionStore(), narrator, new RiskConstraints(5_000, 0.70), new CreditFlowLogger(),
            Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC), 200);
        client = WebTestClient.bindToController(new NegotiationController(engine))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private String openSession() {
        NegotiationSessionView view = client.post().uri("/api/v1/negotiations")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(OPEN_JSON)
            .exchange()
            .expectStatus().isCreated()
            .expectBody(NegotiationSessionView.class)
            .returnResult()
            .getResponseBody();
        assertNotNull(view);
        return view.sessionId();
    }

    @Test
    @DisplayName("open → 201 with round 1 and OPEN state")
    void open_created() {
        client.post().uri("/api/v1/negotiations")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(OPEN_JSON)
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.sessionId").exists()
            .jsonPath("$.companyId").isEqualTo("COMP0042")
            .jsonPath("$.roundNumber").isEqualTo(1)
            .jsonPath("$.state").isEqualTo("OPEN")
            .jsonPath("$.initialOptions.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("open without scores → 400")
    void open_missingScores_badRequest() {
        client.post().uri("/api/v1/negotiations")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"booking\": {\"companyId\": \"COMP0042\", \"bookingAmount\": 50000}}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("scores are required");
    }

    @Test
    @DisplayName("message → verified counter-offer, trace id echoed")
    void message_resolved() {
        when(narrator.proposeCounter(any())).thenReturn(Mono.just(new CounterProposal(
            "₹20,000 upfront and 14 days?", new ProposedTerms(20_000.0, 14, 50_000.0), false)));
        String id = openSession();

        client.post().uri("/api/v1/negotiations/{id}/messages", id)
            .header("X-Trace-Id", "trace-neg")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"message\": \"Can I pay less upfront?\"}")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals("X-Trace-Id", "trace-neg")
            .expectBody()
            .jsonPath("$.state").isEqualTo("RESOLVED")
            .jsonPath("$.roundNumber").isEqualTo(1)
            .jsonPath("$.offer.settlementDays").isEqualTo(14)
            .jsonPath("$.offer.source").isEqualTo("NARRATOR")
            .jsonPath("$.escalate").isEqualTo(false);
    }

    @Test
    @DisplayName("blank message → 400")
    void message_blank_badRequest() {
        String id = openSession();

        client.post().uri("/api/v1/negotiations/{id}/messages", id)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"message\": \"  \"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("message is required");
        verifyNoInteractions(narrator);
    }

    @Test
    @DisplayName("unknown session → 404")
    void message_unknownSession_notFound() {
        client.post().uri("/api/v1/negotiations/{id}/messages", "no-such-session")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"message\": \"hello\"}")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.status").isEqualTo(404);

        client.get().uri("/api/v1/negotiations/{id}", "no-such-session")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET reflects the session; DELETE → 204, then 404")
    void findAndReset() {
        String id = openSession();

        client.get().uri("/api/v1/negotiations/{id}", id)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sessionId").isEqualTo(id)
            .jsonPath("$.transcript.length()").isEqualTo(0);

        client.delete().uri("/api/v1/negotiations/{id}", id)
            .exchange()
            .expectStatus().isNoContent();

        client.delete().uri("/api/v1/negotiations/{id}", id)
            .exchange()
            .expectStatus().isNotFound();
    }
}

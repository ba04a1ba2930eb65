package com.aerox.orchestrator.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RestScoringClientTest {

    private static RestScoringClient clientReturning(AtomicReference<ClientRequest> seen, Mono<ClientResponse> response) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://scoring.local")
            .exchangeFunction(request -> {
                seen.set(request);
                return response;
            })
            .build();
        return new RestScoringClient(webClient, 200);
    }

    @Test
    @DisplayName("scores are fetched per company with the trace header")
    void score_ok() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        RestScoringClient client = clientReturning(seen, Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("{\"intentScore\":0.32,\"capacityScore\":0.55,\"pd7d\":0.02,\"pd14d\":0.08,\"pd30d\":0.15,"
                  + "\"riskCategory\":\"YELLOW\"}")
            .build()));

        StepVerifier.create(client.score("COMP0042", "trace-9"))
            .assertNext(s -> {
                assertEquals(0.32, s.intentScore());
                assertEquals(0.15, s.pd30d());
            })
            .verifyComplete();
        assertEquals("/api/v1/scores/COMP0042", seen.get().url().getPath());
        assertEquals("trace-9", seen.get().headers().getFirst("X-Trace-Id"));
    }

    @Test
    @DisplayName("HTTP error propagates to the caller")
    void score_httpError() {
        RestScoringClient client = clientReturning(new AtomicReference<>(),
            Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

        StepVerifier.create(client.score("COMP0042", "t"))
            .expectError(WebClientResponseException.class)
            .verify();
    }

    @Test
    @DisplayName("slow scorer times out")
    void score_timeout() {
        RestScoringClient client = clientReturning(new AtomicReference<>(), Mono.never());

        StepVerifier.create(client.score("COMP0042", "t"))
            .expectError(TimeoutException.class)
            .verify();
    }
}

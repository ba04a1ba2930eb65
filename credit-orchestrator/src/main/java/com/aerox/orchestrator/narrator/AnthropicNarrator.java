package com.aerox.orchestrator.narrator;

import com.aerox.common.exception.CreditEngineException;
import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.CustomerMessage;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.aerox.common.negotiation.CounterProposal;
import com.aerox.common.negotiation.NegotiationContext;
import com.aerox.common.negotiation.NegotiationSession;
import com.aerox.common.negotiation.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static com.aerox.common.options.OptionsGenerator.money;

/**
 * {@link Narrator} backed by the Anthropic Messages API.
 *
 * <p>Every request pre-fills the assistant turn with <code>{</code> so the reply is the
 * remainder of a single JSON object, which {@link NarratorResponseParser} then reads strictly.
 * No fallback is applied here: a missing API key, an HTTP failure, a timeout or a malformed
 * reply all surface as an error signal and the caller falls back.
 */
@Service
public class AnthropicNarrator implements Narrator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicNarrator.class);

    private static final String JSON_PREFILL = "{";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final NarratorResponseParser parser;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${narrator.model:claude-haiku-4-5-20251001}")
    private String model;

    @Value("${narrator.max-tokens:600}")
    private int maxTokens;

    @Value("${narrator.timeout-ms:4000}")
    private long timeoutMs;

    public AnthropicNarrator(WebClient.Builder builder, ObjectMapper objectMapper,
                             NarratorResponseParser parser,
                             @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    @Override
    public Mono<CustomerMessage> composeMessage(DecisionNarrationContext context) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("[Narrator] No Anthropic API key configured. companyId={} traceId={}",
                     context.booking().companyId(), context.traceId());
            return Mono.error(new CreditEngineException("Narrator", "no Anthropic API key configured"));
        }
        List<String> defaultLabels = MessageTemplates.callToActionLabels(context.options());

        return Mono.fromCallable(() -> buildMessagePrompt(context))
            .flatMap(this::callAnthropicApi)
            .map(reply -> parser.parseMessage(reply, defaultLabels))
            .doOnNext(m -> log.info("[Narrator] Message composed. companyId={} chars={} traceId={}",
                                    context.booking().companyId(), m.body().length(), context.traceId()));
    }

    @Override
    public Mono<CounterProposal> proposeCounter(NegotiationContext context) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("[Narrator] No Anthropic API key configured. sessionId={} round={}",
                     context.sessionId(), context.roundNumber());
            return Mono.error(new CreditEngineException("Narrator", "no Anthropic API key configured"));
        }

        return Mono.fromCallable(() -> buildNegotiationPrompt(context))
            .flatMap(this::callAnthropicApi)
            .map(parser::parseCounter)
            .doOnNext(p -> log.info("[Narrator] Counter proposed. sessionId={} round={} hasOffer={} escalateHint={}",
                                    context.sessionId(), context.roundNumber(), p.offer() != null,
                                    p.escalateHint()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildMessagePrompt(DecisionNarrationContext context) {
        BookingRequest booking = context.booking();
        String options = context.options().stream()
            .map(MessageTemplates::describe)
            .collect(Collectors.joining("\n\n"));

        return String.format(Locale.US, """
            You are AEROX's customer communication specialist. Write a professional WhatsApp message \
            offering the credit options below. Do not change any amount, day count or option label.

            Company:             %s
            Requested amount:    ₹%s
            Current outstanding: ₹%s
            Credit limit:        ₹%s
            Route:               %s
            Exceeds available credit by: ₹%s

            Options:
            %s

            Guidelines:
              - Empathetic, professional tone, 150-200 words
              - Present every option with its label and recommend Option A (lowest friction)
              - Clear call to action: reply with the option label

            Respond ONLY with a JSON object in this exact format:
            {"subject": "%s", "body": "<message>", "cta_buttons": %s}
            """,
            booking.companyName(),
            money(booking.bookingAmount()),
            money(booking.currentOutstanding()),
            money(booking.creditLimit()),
            booking.route() != null ? booking.route() : "n/a",
            money(booking.creditLimitShortfall()),
            options,
            MessageTemplates.subject(booking),
            jsonArray(MessageTemplates.callToActionLabels(context.options())));
    }

    String buildNegotiationPrompt(NegotiationContext context) {
        BookingRequest booking = context.booking();
        RiskScores scores = context.scores();
        RiskConstraints constraints = context.constraints();

        String options = context.initialOptions().isEmpty()
            ? "  (none)"
            : context.initialOptions().stream()
                .map(AnthropicNarrator::summarize)
                .collect(Collectors.joining("\n"));

        String history = context.transcript().isEmpty()
            ? "  (no previous messages)"
            : context.transcript().stream()
                .map(t -> "  " + (t.role() == Turn.Role.CUSTOMER ? "Customer" : "Agent") + ": " + t.text())
                .collect(Collectors.joining("\n"));

        return String.format(Locale.US, """
            You are AEROX's credit negotiation specialist. The customer declined the initial options.

            Company:          %s
            Booking amount:   ₹%s
            Outstanding:      ₹%s
            Total exposure:   ₹%s
            Expected loss must not exceed ₹%s
            LGD: %.2f   PD(7d): %.4f   PD(14d): %.4f   PD(30d): %.4f

            Initial options:
            %s

            Conversation so far:
            %s

            Customer message: %s
            Negotiation round: %d of %d

            Propose modified terms. Expected loss = PD × (outstanding + approved amount − upfront) × LGD,
            using the PD for the next horizon at or above the settlement days. Settlement days must be
            between 7 and 90, upfront must not exceed the approved amount, and the approved amount must
            not exceed the booking amount. If no terms can work, set "offer" to null and "escalate" to true.

            Respond ONLY with a JSON object in this exact format:
            {"response": "<reply to the customer>", \
            "offer": {"upfront": <number>, "settlement_days": <integer>, "approved_amount": <number>} or null, \
            "escalate": true|false}
            """,
            booking.companyName(),
            money(booking.bookingAmount()),
            money(booking.currentOutstanding()),
            money(context.totalExposure()),
            money(constraints.maxExpectedLoss()),
            constraints.lgd(), scores.pd7d(), scores.pd14d(), scores.pd30d(),
            options, history,
            context.customerMessage(),
            context.roundNumber(), NegotiationSession.MAX_ROUNDS);
    }

    // ── HTTP ──────────────────────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(
                Map.of("role", "user", "content", prompt),
                Map.of("role", "assistant", "content", JSON_PREFILL))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new CreditEngineException("Narrator", "failed to read Anthropic response", e);
        }
        JsonNode first = root.path("content").path(0);
        if (!first.path("text").isTextual()) {
            throw new CreditEngineException("Narrator", "Anthropic response has no text content");
        }
        return JSON_PREFILL + first.path("text").asText();
    }

    // ── formatting ────────────────────────────────────────────────────────────

    private static String summarize(CreditOption option) {
        return String.format(Locale.US, "  Option %s: %s, %d days, ₹%,.0f upfront, ₹%,.0f approved, EL ₹%,.2f",
                             option.optionId(), option.kind().wireName(), option.settlementDays(),
                             option.upfrontAmount(), option.approvedAmount(), option.expectedLoss());
    }

    private String jsonArray(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new CreditEngineException("Narrator", "failed to encode labels", e);
        }
    }
}

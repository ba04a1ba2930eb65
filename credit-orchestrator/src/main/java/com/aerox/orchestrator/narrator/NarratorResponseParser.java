package com.aerox.orchestrator.narrator;

import com.aerox.common.exception.CreditEngineException;
import com.aerox.common.model.CustomerMessage;
import com.aerox.common.negotiation.CounterProposal;
import com.aerox.common.negotiation.ProposedTerms;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads narrator replies into fixed shapes.
 *
 * <p>The reply must be a single JSON object; anything else is rejected with a
 * {@link CreditEngineException}. Inside a counter proposal, offer fields of the wrong type
 * (including day counts that are fractional or overflow an int) are read as absent so that verification rejects the offer rather than the whole reply.
 *
 * <pre>
 *   message:  {"subject": "...", "body": "...", "cta_buttons": ["Select A", ...]}
 *   counter:  {"response": "...", "offer": {"upfront": n, "settlement_days": n, "approved_amount": n} | null,
 *              "escalate": true|false}
 * </pre>
 */
@Component
public class NarratorResponseParser {

    private static final String COMPONENT = "NarratorResponseParser";

    private final ObjectMapper objectMapper;

    public NarratorResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CustomerMessage parseMessage(String reply, List<String> defaultLabels) {
        JsonNode root = readObject(reply);
        String subject = requireText(root, "subject");
        String body = requireText(root, "body");

        List<String> labels = new ArrayList<>();
        JsonNode buttons = root.path("cta_buttons");
        if (buttons.isArray()) {
            for (JsonNode button : buttons) {
                if (button.isTextual() && !button.asText().isBlank()) {
                    labels.add(button.asText());
                }
            }
        }
        return new CustomerMessage(subject, body, labels.isEmpty() ? defaultLabels : labels);
    }

    public CounterProposal parseCounter(String reply) {
        JsonNode root = readObject(reply);
        String response = requireText(root, "response");

        ProposedTerms terms = null;
        JsonNode offer = root.path("offer");
        if (offer.isObject()) {
            terms = new ProposedTerms(
                number(offer, "upfront"),
                days(offer),
                number(offer, "approved_amount"));
        }
        boolean escalate = root.path("escalate").asBoolean(false);
        return new CounterProposal(response, terms, escalate);
    }

    private JsonNode readObject(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new CreditEngineException(COMPONENT, "empty narrator reply");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reply.trim());
        } catch (JsonProcessingException e) {
            throw new CreditEngineException(COMPONENT, "narrator reply is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CreditEngineException(COMPONENT, "narrator reply is not a JSON object");
        }
        return root;
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new CreditEngineException(COMPONENT, "narrator reply has no '" + field + "' text");
        }
        return node.asText();
    }

    /** Whole number of days that fits an int; fractions and overflowing values are absent. */
    private static Integer days(JsonNode offer) {
        JsonNode value = offer.path("settlement_days");
        return value.isIntegralNumber() && value.canConvertToInt() ? value.intValue() : null;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }
}

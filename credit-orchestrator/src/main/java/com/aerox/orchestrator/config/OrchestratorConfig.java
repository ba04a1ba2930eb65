package com.aerox.orchestrator.config;

import com.aerox.common.model.DecisionMatrix;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Value("${services.scoring.base-url}")
    private String scoringUrl;

    @Value("${credit.risk.max-expected-loss:5000}")
    private double maxExpectedLoss;

    @Value("${credit.risk.lgd:0.70}")
    private double lgd;

    @Value("${credit.decision-matrix.block-intent-threshold:0.60}")
    private double blockIntentThreshold;

    @Value("${credit.decision-matrix.approve-intent-threshold:0.40}")
    private double approveIntentThreshold;

    @Value("${credit.decision-matrix.approve-capacity-threshold:0.70}")
    private double approveCapacityThreshold;

    // Conservative defaults used when the scorer is unavailable; they land in the yellow band.
    @Value("${credit.scoring.fallback.intent-score:0.50}")
    private double fallbackIntent;

    @Value("${credit.scoring.fallback.capacity-score:0.40}")
    private double fallbackCapacity;

    @Value("${credit.scoring.fallback.pd7d:0.05}")
    private double fallbackPd7;

    @Value("${credit.scoring.fallback.pd14d:0.10}")
    private double fallbackPd14;

    @Value("${credit.scoring.fallback.pd30d:0.20}")
    private double fallbackPd30;

    @Bean
    public RiskConstraints riskConstraints() {
        return new RiskConstraints(maxExpectedLoss, lgd);
    }

    @Bean
    public DecisionMatrix decisionMatrix() {
        return new DecisionMatrix(blockIntentThreshold, approveIntentThreshold, approveCapacityThreshold);
    }

    @Bean
    public RiskScores fallbackScores() {
        return new RiskScores(fallbackIntent, fallbackCapacity, fallbackPd7, fallbackPd14, fallbackPd30);
    }

    @Bean
    public WebClient scoringClient(WebClient.Builder builder) {
        return builder.baseUrl(scoringUrl).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

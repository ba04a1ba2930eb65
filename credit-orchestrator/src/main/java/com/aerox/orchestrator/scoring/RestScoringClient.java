package com.aerox.orchestrator.scoring;

import com.aerox.common.model.RiskScores;
import com.aerox.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Fetches scores from the scoring service over HTTP.
 *
 * <p>Errors are propagated, not absorbed. Out-of-range scores fail {@link RiskScores}
 * construction during decoding and surface as an error as well.
 */
@Component
public class RestScoringClient implements Scorer {

    private static final Logger log = LoggerFactory.getLogger(RestScoringClient.class);

    private final WebClient scoringClient;
    private final Duration  timeout;

    public RestScoringClient(@Qualifier("scoringClient") WebClient scoringClient,
                             @Value("${credit.scoring.timeout-ms:2000}") long timeoutMs) {
        this.scoringClient = scoringClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<RiskScores> score(String companyId, String traceId) {
        return scoringClient.get()
            .uri("/api/v1/scores/{companyId}", companyId)
            .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
            .retrieve()
            .bodyToMono(RiskScores.class)
            .timeout(timeout)
            .doOnNext(s -> log.debug("[ScoringClient] Scores fetched. companyId={} intent={} capacity={} traceId={}",
                                     companyId, s.intentScore(), s.capacityScore(), traceId));
    }
}

package com.aerox.orchestrator.scoring;

import com.aerox.common.model.RiskScores;
import reactor.core.publisher.Mono;

/**
 * Source of intent, capacity and default-probability scores for a company.
 * Implementations may fail; the decision service substitutes its conservative defaults.
 */
public interface Scorer {

    Mono<RiskScores> score(String companyId, String traceId);
}

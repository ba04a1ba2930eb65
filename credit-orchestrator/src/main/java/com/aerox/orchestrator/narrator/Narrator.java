package com.aerox.orchestrator.narrator;

import com.aerox.common.model.CustomerMessage;
import com.aerox.common.negotiation.CounterProposal;
import com.aerox.common.negotiation.NegotiationContext;
import reactor.core.publisher.Mono;

/**
 * Turns structured decisions into customer-facing text and suggests negotiation terms.
 *
 * <p>Both operations may fail or emit malformed data. Callers bound them with a timeout,
 * fall back deterministically and re-verify every number before using it.
 */
public interface Narrator {

    Mono<CustomerMessage> composeMessage(DecisionNarrationContext context);

    Mono<CounterProposal> proposeCounter(NegotiationContext context);
}

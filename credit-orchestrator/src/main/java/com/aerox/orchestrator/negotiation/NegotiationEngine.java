package com.aerox.orchestrator.negotiation;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.aerox.common.exception.SessionNotFoundException;
import com.aerox.common.negotiation.CounterOffer;
import com.aerox.common.negotiation.CounterOfferCalculator;
import com.aerox.common.negotiation.CounterProposal;
import com.aerox.common.negotiation.NegotiationContext;
import com.aerox.common.negotiation.NegotiationMessages;
import com.aerox.common.negotiation.NegotiationRound;
import com.aerox.common.negotiation.NegotiationSession;
import com.aerox.common.trace.TraceContextUtil;
import com.aerox.orchestrator.dto.NegotiationSessionView;
import com.aerox.orchestrator.logger.CreditFlowLogger;
import com.aerox.orchestrator.narrator.Narrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives negotiation rounds.
 *
 * <p>Each round asks the narrator for a counter proposal under a bounded timeout and re-prices
 * its offer with {@link CounterOfferCalculator#verify}. A timeout, error, malformed reply or
 * rejected offer falls back to {@link CounterOfferCalculator#fallback}. The session then applies
 * the outcome ({@link NegotiationSession#complete}). Sessions that are escalated, or have used
 * every round, are answered without calling the narrator.
 *
 * <p>Rounds of one session run strictly one after another through {@link NegotiationSessionStore}.
 */
@Service
public class NegotiationEngine {

    private static final Logger log = LoggerFactory.getLogger(NegotiationEngine.class);

    private final NegotiationSessionStore store;
    private final Narrator                narrator;
    private final RiskConstraints         constraints;
    private final CreditFlowLogger        flowLogger;
    private final Clock                   clock;
    private final Duration                narratorTimeout;

    public NegotiationEngine(NegotiationSessionStore store, Narrator narrator, RiskConstraints constraints,
                             CreditFlowLogger flowLogger, Clock clock,
                             @Value("${narrator.timeout-ms:4000}") long narratorTimeoutMs) {
        this.store = store;
        this.narrator = narrator;
        this.constraints = constraints;
        this.flowLogger = flowLogger;
        this.clock = clock;
        this.narratorTimeout = Duration.ofMillis(narratorTimeoutMs);
    }

    /** Opens a session at round 1, seeded with the options the customer declined. */
    public NegotiationSessionView open(BookingRequest booking, RiskScores scores, List<CreditOption> initialOptions) {
        String sessionId = UUID.randomUUID().toString();
        NegotiationSession session = store.register(
            new NegotiationSession(sessionId, booking, scores, initialOptions, LocalDate.now(clock)));
        log.info("[NegotiationEngine] Session opened. sessionId={} companyId={} initialOptions={}",
                 sessionId, booking.companyId(), initialOptions.size());
        return NegotiationSessionView.of(session);
    }

    /**
     * Processes one customer message.
     *
     * @return the round result; {@link SessionNotFoundException} for an unknown session,
     *         {@link IllegalArgumentException} for a blank message
     */
    public Mono<NegotiationRound> advance(String sessionId, String message, String traceId) {
        if (message == null || message.isBlank()) {
            return Mono.error(new IllegalArgumentException("message is required"));
        }
        Mono<NegotiationRound> round = store.submit(sessionId, session -> runRound(session, message, traceId))
            .doOnNext(r -> flowLogger.logRound(r, traceId));
        return TraceContextUtil.withTraceId(round, traceId);
    }

    /** Snapshot taken after any round already queued for the session. */
    public Mono<NegotiationSessionView> find(String sessionId) {
        return store.submit(sessionId, session -> Mono.fromSupplier(() -> NegotiationSessionView.of(session)));
    }

    /** Drops the session. */
    public void reset(String sessionId) {
        if (!store.remove(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("[NegotiationEngine] Session reset. sessionId={}", sessionId);
    }

    // ── round ─────────────────────────────────────────────────────────────────

    private Mono<NegotiationRound> runRound(NegotiationSession session, String message, String traceId) {
        if (session.isEscalated()) {
            log.info("[NegotiationEngine] Session already escalated — returning cached result. sessionId={} traceId={}",
                     session.sessionId(), traceId);
            return Mono.just(session.escalation());
        }
        if (session.isRoundCeilingReached()) {
            log.info("[NegotiationEngine] Round ceiling reached — escalating. sessionId={} traceId={}",
                     session.sessionId(), traceId);
            return Mono.just(session.escalate(message));
        }

        NegotiationContext context = new NegotiationContext(
            session.sessionId(), session.roundNumber(), session.booking(), session.scores(),
            constraints, session.initialOptions(), session.transcript(), message);

        return Mono.defer(() -> narrator.proposeCounter(context))
            .timeout(narratorTimeout)
            .map(proposal -> verify(proposal, session, traceId))
            .onErrorResume(e -> {
                log.warn("[NegotiationEngine] Narrator failed — using deterministic fallback. sessionId={} round={} traceId={} reason={}",
                         session.sessionId(), context.roundNumber(), traceId, e.getMessage());
                return Mono.just(Optional.empty());
            })
            .defaultIfEmpty(Optional.empty())
            .map(verified -> verified.orElseGet(() -> fallback(session, traceId)))
            .map(reply -> session.complete(message, reply.offer(), reply.text()));
    }

    private Optional<Reply> verify(CounterProposal proposal, NegotiationSession session, String traceId) {
        if (proposal.escalateHint()) {
            log.info("[NegotiationEngine] Narrator suggested escalation (advisory). sessionId={} traceId={}",
                     session.sessionId(), traceId);
        }
        Optional<CounterOffer> offer = CounterOfferCalculator.verify(
            proposal.offer(), session.booking(), session.scores(), constraints);
        if (offer.isEmpty()) {
            log.warn("[NegotiationEngine] Narrator offer rejected by verification. sessionId={} offer={} traceId={}",
                     session.sessionId(), proposal.offer(), traceId);
            return Optional.empty();
        }
        return Optional.of(new Reply(offer.get(), proposal.responseText()));
    }

    private Reply fallback(NegotiationSession session, String traceId) {
        Optional<CounterOffer> offer = CounterOfferCalculator.fallback(session.booking(), session.scores(), constraints);
        if (offer.isEmpty()) {
            log.info("[NegotiationEngine] Fallback offer cannot clear the budget. sessionId={} round={} traceId={}",
                     session.sessionId(), session.roundNumber(), traceId);
            return new Reply(null, null);
        }
        return new Reply(offer.get(), NegotiationMessages.offerResponse(offer.get(), constraints.maxExpectedLoss()));
    }

    private record Reply(CounterOffer offer, String text) {}
}

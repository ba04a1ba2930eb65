package com.aerox.orchestrator.logger;

import com.aerox.common.model.CreditDecision;
import com.aerox.common.negotiation.NegotiationRound;
import com.aerox.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for the credit decision and negotiation pipelines. Side effects only.
 *
 * <p>Decision stages, in order:
 * <ol>
 *   <li>{@link #BOOKING_RECEIVED}</li>
 *   <li>{@link #SCORES_RESOLVED}: scorer answered, or its fallback was applied</li>
 *   <li>{@link #RISK_GATE_EVALUATED}</li>
 *   <li>{@link #OPTIONS_GENERATED} and {@link #OPTIONS_VALIDATED} (yellow band only)</li>
 *   <li>{@link #MESSAGE_COMPOSED} (yellow band only)</li>
 *   <li>{@link #DECISION_CREATED}</li>
 * </ol>
 * Negotiation rounds log {@link #NEGOTIATION_ROUND_COMPLETED}.
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(CreditFlowLogger.SCORES_RESOLVED))
 * </pre>
 */
@Component
public class CreditFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CreditFlowLogger.class);

    public static final String BOOKING_RECEIVED            = "BOOKING_RECEIVED";
    public static final String SCORES_RESOLVED             = "SCORES_RESOLVED";
    public static final String RISK_GATE_EVALUATED         = "RISK_GATE_EVALUATED";
    public static final String OPTIONS_GENERATED           = "OPTIONS_GENERATED";
    public static final String OPTIONS_VALIDATED           = "OPTIONS_VALIDATED";
    public static final String MESSAGE_COMPOSED            = "MESSAGE_COMPOSED";
    public static final String DECISION_CREATED            = "DECISION_CREATED";
    public static final String NEGOTIATION_ROUND_COMPLETED = "NEGOTIATION_ROUND_COMPLETED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on every onNext signal, reading the
     * trace id from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CreditFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CreditFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** Stage line with extra {@code key=value} detail, e.g. {@code "category=yellow"}. */
    public void logWithTraceId(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CreditFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }

    public void logDecision(CreditDecision decision) {
        TraceContextUtil.withMdc(decision.traceId(), () ->
            log.info("[CreditFlow] stage={} companyId={} decision={} category={} options={} traceId={}",
                     DECISION_CREATED,
                     decision.booking().companyId(),
                     decision.decision(),
                     decision.riskCategory().wireName(),
                     decision.options() != null ? decision.options().size() : 0,
                     decision.traceId())
        );
    }

    public void logRound(NegotiationRound round, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CreditFlow] stage={} sessionId={} round={} state={} source={} traceId={}",
                     NEGOTIATION_ROUND_COMPLETED,
                     round.sessionId(),
                     round.roundNumber(),
                     round.state(),
                     round.offer() != null ? round.offer().source() : "none",
                     traceId)
        );
    }
}

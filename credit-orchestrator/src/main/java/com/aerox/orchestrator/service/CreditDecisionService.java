package com.aerox.orchestrator.service;

import com.aerox.common.compliance.ComplianceValidator;
import com.aerox.common.exposure.ExposureCalculator;
import com.aerox.common.gate.RiskGate;
import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditDecision;
import com.aerox.common.model.CreditOption;
import com.aerox.common.model.CustomerMessage;
import com.aerox.common.model.DecisionMatrix;
import com.aerox.common.model.FinancialAnalysis;
import com.aerox.common.model.RiskCategory;
import com.aerox.common.model.RiskConstraints;
import com.aerox.common.model.RiskScores;
import com.aerox.common.model.ValidationResult;
import com.aerox.common.negotiation.NegotiationSession;
import com.aerox.common.options.OptionsGenerator;
import com.aerox.common.trace.TraceContextUtil;
import com.aerox.orchestrator.dto.CreditConfigView;
import com.aerox.orchestrator.logger.CreditFlowLogger;
import com.aerox.orchestrator.narrator.DecisionNarrationContext;
import com.aerox.orchestrator.narrator.MessageTemplates;
import com.aerox.orchestrator.narrator.Narrator;
import com.aerox.orchestrator.scoring.Scorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * End-to-end decision for a fresh booking.
 *
 * <pre>
 *   Scorer (fallback scores on failure)
 *     → RiskGate
 *         GREEN  → APPROVED, full amount, 30 days
 *         RED    → BLOCKED, violated thresholds joined with " | "
 *         YELLOW → ExposureCalculator.analyze
 *                  → OptionsGenerator      (empty      → BLOCKED)
 *                  → ComplianceValidator   (violations → BLOCKED)
 *                  → Narrator message      (template on failure)
 *                  → NEGOTIATE
 * </pre>
 *
 * <p>Collaborator failures never fail the pipeline; they are logged and replaced.
 * Input errors are rejected before scoring.
 */
@Service
public class CreditDecisionService {

    private static final Logger log = LoggerFactory.getLogger(CreditDecisionService.class);

    public static final String NO_OPTIONS_REASON = "No options satisfy risk constraints";

    private final Scorer           scorer;
    private final Narrator         narrator;
    private final RiskConstraints  constraints;
    private final DecisionMatrix   matrix;
    private final RiskScores       fallbackScores;
    private final CreditFlowLogger flowLogger;
    private final Duration         narratorTimeout;

    public CreditDecisionService(Scorer scorer, Narrator narrator,
                                 RiskConstraints constraints, DecisionMatrix matrix,
                                 @Qualifier("fallbackScores") RiskScores fallbackScores,
                                 CreditFlowLogger flowLogger,
                                 @Value("${narrator.timeout-ms:4000}") long narratorTimeoutMs) {
        this.scorer = scorer;
        this.narrator = narrator;
        this.constraints = constraints;
        this.matrix = matrix;
        this.fallbackScores = fallbackScores;
        this.flowLogger = flowLogger;
        this.narratorTimeout = Duration.ofMillis(narratorTimeoutMs);
    }

    public Mono<CreditDecision> process(BookingRequest booking, String traceId) {
        if (booking == null) {
            return Mono.error(new IllegalArgumentException("booking is required"));
        }
        flowLogger.logWithTraceId(CreditFlowLogger.BOOKING_RECEIVED, traceId,
                                  "companyId=" + booking.companyId());

        Mono<CreditDecision> pipeline = Mono.defer(() -> scorer.score(booking.companyId(), traceId))
            .onErrorResume(e -> {
                log.warn("[CreditDecision] Scorer failed — using fallback scores. companyId={} traceId={} reason={}",
                         booking.companyId(), traceId, e.getMessage());
                return Mono.just(fallbackScores);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("[CreditDecision] Scorer returned nothing — using fallback scores. companyId={} traceId={}",
                         booking.companyId(), traceId);
                return fallbackScores;
            }))
            .doOnEach(flowLogger.stage(CreditFlowLogger.SCORES_RESOLVED))
            .flatMap(scores -> decide(booking, scores, traceId))
            .doOnNext(flowLogger::logDecision);

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public CreditConfigView configView() {
        return new CreditConfigView(matrix, constraints, NegotiationSession.MAX_ROUNDS);
    }

    // ── decision paths ────────────────────────────────────────────────────────

    private Mono<CreditDecision> decide(BookingRequest booking, RiskScores rawScores, String traceId) {
        RiskCategory category = RiskGate.categorize(rawScores, matrix);
        if (rawScores.riskCategory() != null && rawScores.riskCategory() != category) {
            log.info("[CreditDecision] Scorer category overridden by gate. companyId={} scorer={} gate={} traceId={}",
                     booking.companyId(), rawScores.riskCategory().wireName(), category.wireName(), traceId);
        }
        RiskScores scores = rawScores.withCategory(category);
        flowLogger.logWithTraceId(CreditFlowLogger.RISK_GATE_EVALUATED, traceId,
                                  "category=" + category.wireName());

        return switch (category) {
            case GREEN  -> Mono.just(CreditDecision.approved(traceId, booking, scores));
            case RED    -> Mono.just(CreditDecision.blocked(traceId, booking, scores, RiskCategory.RED,
                                                            String.join(" | ", RiskGate.blockReasons(scores, matrix))));
            case YELLOW -> negotiate(booking, scores, traceId);
        };
    }

    private Mono<CreditDecision> negotiate(BookingRequest booking, RiskScores scores, String traceId) {
        FinancialAnalysis analysis = ExposureCalculator.analyze(booking, scores, constraints);

        List<CreditOption> options = OptionsGenerator.generate(
            analysis.totalExposure(), booking.currentOutstanding(), booking.bookingAmount(),
            scores.pd7d(), scores.pd14d(), scores.pd30d(),
            constraints.lgd(), constraints.maxExpectedLoss());
        flowLogger.logWithTraceId(CreditFlowLogger.OPTIONS_GENERATED, traceId,
                                  "baselineEL=" + Math.round(analysis.baselineExpectedLoss())
                                      + " options=" + options.size());

        if (options.isEmpty()) {
            return Mono.just(CreditDecision.blocked(traceId, booking, scores, analysis, NO_OPTIONS_REASON));
        }

        ValidationResult validation = ComplianceValidator.validate(options, constraints.maxExpectedLoss());
        flowLogger.logWithTraceId(CreditFlowLogger.OPTIONS_VALIDATED, traceId,
                                  "compliant=" + validation.compliant());
        if (!validation.compliant()) {
            log.error("[CreditDecision] Generated options failed compliance. companyId={} violations={} traceId={}",
                      booking.companyId(), validation.violations(), traceId);
            return Mono.just(CreditDecision.blocked(traceId, booking, scores, analysis, options, validation));
        }

        DecisionNarrationContext context = new DecisionNarrationContext(traceId, booking, scores, analysis, options);
        return composeMessage(context)
            .doOnNext(m -> flowLogger.logWithTraceId(CreditFlowLogger.MESSAGE_COMPOSED, traceId))
            .map(message -> CreditDecision.negotiate(traceId, booking, scores, analysis, options,
                                                     validation, message));
    }

    private Mono<CustomerMessage> composeMessage(DecisionNarrationContext context) {
        return Mono.defer(() -> narrator.composeMessage(context))
            .timeout(narratorTimeout)
            .onErrorResume(e -> {
                log.warn("[CreditDecision] Narrator failed — using message template. companyId={} traceId={} reason={}",
                         context.booking().companyId(), context.traceId(), e.getMessage());
                return Mono.just(MessageTemplates.decisionMessage(context));
            })
            .switchIfEmpty(Mono.fromSupplier(() -> MessageTemplates.decisionMessage(context)));
    }
}

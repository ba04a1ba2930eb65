package com.aerox.orchestrator.controller;

import com.aerox.common.negotiation.NegotiationRound;
import com.aerox.common.trace.TraceContextUtil;
import com.aerox.orchestrator.dto.NegotiationMessageRequest;
import com.aerox.orchestrator.dto.NegotiationSessionView;
import com.aerox.orchestrator.dto.OpenNegotiationRequest;
import com.aerox.orchestrator.negotiation.NegotiationEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/negotiations")
public class NegotiationController {

    private final NegotiationEngine negotiationEngine;

    public NegotiationController(NegotiationEngine negotiationEngine) {
        this.negotiationEngine = negotiationEngine;
    }

    @PostMapping
    public ResponseEntity<NegotiationSessionView> open(@RequestBody OpenNegotiationRequest request) {
        NegotiationSessionView view = negotiationEngine.open(request.booking(), request.scores(),
                                                             request.initialOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @PostMapping("/{sessionId}/messages")
    public Mono<ResponseEntity<NegotiationRound>> message(
            @PathVariable String sessionId,
            @RequestBody NegotiationMessageRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return negotiationEngine.advance(sessionId, request.message(), traceId)
            .map(round -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(round));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<NegotiationSessionView>> find(@PathVariable String sessionId) {
        return negotiationEngine.find(sessionId).map(ResponseEntity::ok);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> reset(@PathVariable String sessionId) {
        negotiationEngine.reset(sessionId);
        return ResponseEntity.noContent().build();
    }
}

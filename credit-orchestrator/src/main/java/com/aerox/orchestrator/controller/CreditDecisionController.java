package com.aerox.orchestrator.controller;

import com.aerox.common.model.BookingRequest;
import com.aerox.common.model.CreditDecision;
import com.aerox.common.trace.TraceContextUtil;
import com.aerox.orchestrator.dto.CreditConfigView;
import com.aerox.orchestrator.service.CreditDecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/credit")
public class CreditDecisionController {

    private final CreditDecisionService decisionService;

    public CreditDecisionController(CreditDecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @PostMapping("/decisions")
    public Mono<ResponseEntity<CreditDecision>> decide(
            @RequestBody BookingRequest booking,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return decisionService.process(booking, traceId)
            .map(decision -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(decision));
    }

    @GetMapping("/config")
    public ResponseEntity<CreditConfigView> config() {
        return ResponseEntity.ok(decisionService.configView());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}

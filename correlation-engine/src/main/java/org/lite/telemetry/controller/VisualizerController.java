package org.lite.telemetry.controller;

import lombok.RequiredArgsConstructor;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.WorkflowTraceReport;
import org.lite.telemetry.service.TraceAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Coordinator pipeline executions correlated with their trace spans.
 */
@RestController
@RequestMapping("/api/visualizer")
@RequiredArgsConstructor
public class VisualizerController {

    private final TraceAnalysisService traceAnalysisService;

    @GetMapping("/traces")
    public Mono<ResponseEntity<ResultEnvelope<WorkflowTraceReport>>> traces(
            @RequestParam(required = false) String traceKey,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        return traceAnalysisService.getWorkflowTraces(limit, traceKey, skipCache).map(ResponseEntity::ok);
    }
}

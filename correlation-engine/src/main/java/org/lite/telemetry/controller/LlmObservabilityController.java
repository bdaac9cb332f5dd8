package org.lite.telemetry.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.QualityReport;
import org.lite.telemetry.model.SecurityReport;
import org.lite.telemetry.service.LlmObservabilityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/llm-observability")
@RequiredArgsConstructor
@Slf4j
public class LlmObservabilityController {

    private final LlmObservabilityService llmObservabilityService;

    @GetMapping("/security")
    public Mono<ResponseEntity<ResultEnvelope<SecurityReport>>> security(
            @RequestParam(required = false) String checkType,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String detected,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String traceId,
            @RequestParam(required = false) String model,
            @RequestParam(defaultValue = "24h") String timeRange,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        Map<String, String> filters = new LinkedHashMap<>();
        putIfPresent(filters, "checkType", checkType);
        putIfPresent(filters, "severity", severity);
        putIfPresent(filters, "detected", detected);
        putIfPresent(filters, "location", location);
        putIfPresent(filters, "traceId", traceId);
        putIfPresent(filters, "model", model);
        putIfPresent(filters, "timeRange", timeRange);
        return llmObservabilityService.security(filters, limit, offset, skipCache).map(ResponseEntity::ok);
    }

    @GetMapping("/quality")
    public Mono<ResponseEntity<ResultEnvelope<QualityReport>>> quality(
            @RequestParam(required = false) String checkType,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String passed,
            @RequestParam(required = false) String traceId,
            @RequestParam(required = false) String model,
            @RequestParam(defaultValue = "24h") String timeRange,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        Map<String, String> filters = new LinkedHashMap<>();
        putIfPresent(filters, "checkType", checkType);
        putIfPresent(filters, "severity", severity);
        putIfPresent(filters, "passed", passed);
        putIfPresent(filters, "traceId", traceId);
        putIfPresent(filters, "model", model);
        putIfPresent(filters, "timeRange", timeRange);
        return llmObservabilityService.quality(filters, limit, offset, skipCache).map(ResponseEntity::ok);
    }

    private static void putIfPresent(Map<String, String> filters, String name, String value) {
        if (value != null && !value.isBlank()) {
            filters.put(name, value);
        }
    }
}

package org.lite.telemetry.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.dto.TraceBatchRequest;
import org.lite.telemetry.dto.TraceListQuery;
import org.lite.telemetry.model.TraceBatchReport;
import org.lite.telemetry.model.TraceDetail;
import org.lite.telemetry.model.TraceListReport;
import org.lite.telemetry.service.TraceAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/apm")
@RequiredArgsConstructor
@Slf4j
public class ApmController {

    private final TraceAnalysisService traceAnalysisService;
    private final Clock clock;

    @GetMapping("/traces")
    public Mono<ResponseEntity<ResultEnvelope<TraceListReport>>> traces(
            @RequestParam(defaultValue = "1") double hours,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "") String service,
            @RequestParam(defaultValue = "") String operation,
            @RequestParam(defaultValue = "") String status,
            @RequestParam(defaultValue = "0") long minDuration,
            @RequestParam(defaultValue = "timeEarliestSpanStarted") String sortBy,
            @RequestParam(defaultValue = "DESC") String sortOrder,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        TraceListQuery query = new TraceListQuery();
        query.setHours(hours);
        query.setLimit(limit);
        query.setService(service);
        query.setOperation(operation);
        query.setStatus(status);
        query.setMinDuration(minDuration);
        query.setSortBy(sortBy);
        query.setSortOrder(sortOrder);
        return traceAnalysisService.listTraces(query, skipCache).map(ResponseEntity::ok);
    }

    @GetMapping("/drilldown")
    public Mono<ResponseEntity<ResultEnvelope<TraceDetail>>> drilldown(
            @RequestParam(required = false) String traceKey,
            @RequestParam(defaultValue = "false") boolean skipCache) {
        if (traceKey == null || traceKey.isBlank()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ResultEnvelope.rejected("traceKey parameter is required", clock.instant().toString())));
        }
        return traceAnalysisService.getTraceDetail(traceKey.trim(), skipCache).map(ResponseEntity::ok);
    }

    /**
     * Detail for several traces at once, for side-by-side comparison.
     */
    @PostMapping("/drilldown")
    public Mono<ResponseEntity<ResultEnvelope<TraceBatchReport>>> drilldownBatch(@RequestBody TraceBatchRequest request) {
        List<String> keys = request.getTraceKeys() == null ? List.of() : request.getTraceKeys().stream()
                .filter(key -> key != null && !key.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        if (keys.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ResultEnvelope.rejected("traceKeys array is required", clock.instant().toString())));
        }
        log.info("Batch drilldown requested for {} traces", keys.size());
        return traceAnalysisService.getTraceDetails(keys, request.isSkipCache()).map(ResponseEntity::ok);
    }
}

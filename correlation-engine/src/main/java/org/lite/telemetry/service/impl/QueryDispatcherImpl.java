package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.dto.QueryRequest;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.dto.TraceListQuery;
import org.lite.telemetry.exception.InvalidQueryException;
import org.lite.telemetry.service.BlockingAnalysisService;
import org.lite.telemetry.service.CoordinatorStatusService;
import org.lite.telemetry.service.LlmObservabilityService;
import org.lite.telemetry.service.ParallelExecutionService;
import org.lite.telemetry.service.QueryDispatcher;
import org.lite.telemetry.service.SqlMonitorService;
import org.lite.telemetry.service.TraceAnalysisService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class QueryDispatcherImpl implements QueryDispatcher {

    static final int DEFAULT_CHECK_LIMIT = 50;
    static final int DEFAULT_WORKFLOW_LIMIT = 10;

    private static final Set<String> SECURITY_FILTERS = Set.of("checkType", "severity", "detected", "location", "traceId", "model", "timeRange");
    private static final Set<String> QUALITY_FILTERS = Set.of("checkType", "severity", "passed", "traceId", "model", "timeRange");

    private final BlockingAnalysisService blockingAnalysisService;
    private final SqlMonitorService sqlMonitorService;
    private final ParallelExecutionService parallelExecutionService;
    private final TraceAnalysisService traceAnalysisService;
    private final LlmObservabilityService llmObservabilityService;
    private final CoordinatorStatusService coordinatorStatusService;

    @Override
    public Mono<ResultEnvelope<?>> dispatch(QueryRequest request) {
        if (request == null || request.getQueryKind() == null) {
            return Mono.error(new InvalidQueryException("queryKind is required"));
        }
        QueryRequest.Options options = request.getOptions() != null ? request.getOptions() : new QueryRequest.Options();
        boolean skipCache = options.isSkipCache();
        log.info("Dispatching {} query with parameters {}", request.getQueryKind().getValue(), request.getParameters());
        return Mono.defer(() -> route(request, options, skipCache));
    }

    private Mono<ResultEnvelope<?>> route(QueryRequest request, QueryRequest.Options options, boolean skipCache) {
        return switch (request.getQueryKind()) {
            case BLOCKING_SESSIONS -> widen(blockingAnalysisService.analyze(request.parameter("database", null), skipCache));
            case SQL_MONITOR -> widen(sqlMonitorService.monitor(request.parameter("database", null), skipCache));
            case PARALLEL_EXECUTION -> widen(parallelExecutionService.analyze(request.parameter("database", null), skipCache));
            case TRACE_LIST -> widen(traceAnalysisService.listTraces(traceListQuery(request, options), skipCache));
            case TRACE_DETAIL -> {
                String traceKey = request.parameter("traceKey", null);
                if (traceKey == null) {
                    yield Mono.error(new InvalidQueryException("traceKey parameter is required"));
                }
                yield widen(traceAnalysisService.getTraceDetail(traceKey, skipCache));
            }
            case WORKFLOW_TRACES -> widen(traceAnalysisService.getWorkflowTraces(
                    limit(options, DEFAULT_WORKFLOW_LIMIT), request.parameter("traceKey", null), skipCache));
            case SECURITY_CHECKS -> widen(llmObservabilityService.security(
                    select(request, SECURITY_FILTERS), limit(options, DEFAULT_CHECK_LIMIT), offset(options), skipCache));
            case QUALITY_CHECKS -> widen(llmObservabilityService.quality(
                    select(request, QUALITY_FILTERS), limit(options, DEFAULT_CHECK_LIMIT), offset(options), skipCache));
            case COORDINATOR_STATUS -> widen(coordinatorStatusService.status(skipCache));
        };
    }

    private static TraceListQuery traceListQuery(QueryRequest request, QueryRequest.Options options) {
        TraceListQuery query = new TraceListQuery();
        query.setHours(parseDouble(request.parameter("hours", null), query.getHours()));
        query.setLimit(options.getLimit() != null ? options.getLimit() : query.getLimit());
        query.setService(request.parameter("service", ""));
        query.setOperation(request.parameter("operation", ""));
        query.setStatus(request.parameter("status", ""));
        query.setMinDuration((long) parseDouble(request.parameter("minDuration", null), 0));
        query.setSortBy(request.parameter("sortBy", query.getSortBy()));
        query.setSortOrder(request.parameter("sortOrder", query.getSortOrder()));
        return query;
    }

    private static Map<String, String> select(QueryRequest request, Set<String> names) {
        Map<String, String> selected = new LinkedHashMap<>();
        for (String name : names) {
            String value = request.parameter(name, null);
            if (value != null) {
                selected.put(name, value);
            }
        }
        return selected;
    }

    private static int limit(QueryRequest.Options options, int defaultLimit) {
        return options.getLimit() != null ? options.getLimit() : defaultLimit;
    }

    private static int offset(QueryRequest.Options options) {
        return options.getOffset() != null ? options.getOffset() : 0;
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Not a number: " + value);
        }
    }

    private static Mono<ResultEnvelope<?>> widen(Mono<? extends ResultEnvelope<?>> envelope) {
        return envelope.map(e -> e);
    }
}

package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.TracingProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.dto.TraceListQuery;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.enums.ResultStatus;
import org.lite.telemetry.model.RawRecord;
import org.lite.telemetry.model.SpanHierarchy;
import org.lite.telemetry.model.SpanRecord;
import org.lite.telemetry.model.TraceBatchReport;
import org.lite.telemetry.model.TraceDetail;
import org.lite.telemetry.model.TraceListReport;
import org.lite.telemetry.model.TraceSummary;
import org.lite.telemetry.model.WorkflowExecutionTrace;
import org.lite.telemetry.model.WorkflowTraceReport;
import org.lite.telemetry.service.DemoDataProvider;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.service.SpanHierarchyBuilder;
import org.lite.telemetry.service.StageMapper;
import org.lite.telemetry.service.TraceAnalysisService;
import org.lite.telemetry.service.TracingClient;
import org.lite.telemetry.util.CacheKeys;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class TraceAnalysisServiceImpl implements TraceAnalysisService {

    static final int MAX_WORKFLOW_TRACES = 50;

    private final TracingClient tracingClient;
    private final TracingProperties tracingProperties;
    private final SchemaNormalizer normalizer;
    private final SpanHierarchyBuilder hierarchyBuilder;
    private final StageMapper stageMapper;
    private final DerivedMetricsCalculator metrics;
    private final DemoDataProvider demoData;
    private final ResilientQueryExecutor executor;
    private final Clock clock;

    @Override
    public Mono<ResultEnvelope<TraceListReport>> listTraces(TraceListQuery query, boolean skipCache) {
        Map<String, String> params = query.toParams();
        log.info("Trace list requested with {}", params);

        return executor.execute(QuerySpec.<TraceListReport>builder()
                .kind(QueryKind.TRACE_LIST)
                .cacheName(CacheProperties.TRACE_LIST)
                .cacheKey(CacheKeys.of(params))
                .skipCache(skipCache)
                .missingSetting(missingDomainSetting())
                .fetch(() -> {
                    Instant end = clock.instant();
                    Instant start = end.minus(Duration.ofMillis((long) (query.getEffectiveHours() * 3_600_000)));
                    return tracingClient.listTraces(start, end, query.getEffectiveLimit())
                            .map(payload -> toTraceList(payload, params, start, end));
                })
                .emptyPayload(() -> new TraceListReport(List.of(), 0, params, null, null))
                .build());
    }

    @Override
    public Mono<ResultEnvelope<TraceDetail>> getTraceDetail(String traceKey, boolean skipCache) {
        log.info("Trace detail requested for {}", traceKey);
        return executor.execute(QuerySpec.<TraceDetail>builder()
                .kind(QueryKind.TRACE_DETAIL)
                .cacheName(CacheProperties.TRACE_DETAIL)
                .cacheKey(traceKey)
                .skipCache(skipCache)
                .missingSetting(missingDomainSetting())
                .fetch(() -> tracingClient.getTrace(traceKey).map(trace -> toTraceDetail(traceKey, trace)))
                .emptyPayload(() -> TraceDetail.empty(traceKey))
                .build());
    }

    @Override
    public Mono<ResultEnvelope<TraceBatchReport>> getTraceDetails(List<String> traceKeys, boolean skipCache) {
        List<String> batch = traceKeys.stream()
                .limit(tracingProperties.getMaxBatchSize())
                .collect(Collectors.toList());
        if (batch.size() < traceKeys.size()) {
            log.warn("Trace batch of {} truncated to {}", traceKeys.size(), batch.size());
        }

        return Flux.fromIterable(batch)
                .concatMap(key -> getTraceDetail(key, skipCache))
                .collectList()
                .map(details -> {
                    int connected = (int) details.stream().filter(ResultEnvelope::isConnected).count();
                    ResultStatus status = connected > 0 || details.isEmpty()
                            ? ResultStatus.CONNECTED : details.get(0).getStatus();
                    return ResultEnvelope.<TraceBatchReport>builder()
                            .status(status)
                            .payload(new TraceBatchReport(details, traceKeys.size(), connected))
                            .timestamp(clock.instant().toString())
                            .build();
                });
    }

    @Override
    public Mono<ResultEnvelope<WorkflowTraceReport>> getWorkflowTraces(int limit, String traceKey, boolean skipCache) {
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_WORKFLOW_TRACES));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", effectiveLimit);
        params.put("traceKey", traceKey);
        log.info("Workflow traces requested with {}", params);

        return executor.execute(QuerySpec.<WorkflowTraceReport>builder()
                .kind(QueryKind.WORKFLOW_TRACES)
                .cacheName(CacheProperties.WORKFLOW_TRACES)
                .cacheKey(CacheKeys.of(params))
                .skipCache(skipCache)
                .missingSetting(tracingProperties.isConfigured() ? null : TracingProperties.BASE_URL_SETTING)
                .demoWhenUnconfigured(true)
                .fetch(() -> tracingClient.listWorkflowTraces(effectiveLimit, traceKey).map(this::toWorkflowReport))
                .emptyPayload(() -> workflowReport(List.of(), "none"))
                .demoPayload(() -> workflowReport(demoData.workflowSpans(effectiveLimit).stream()
                        .map(spans -> stageMapper.toWorkflowTrace(hierarchy(spans.get(0).getTraceKey(), spans)))
                        .collect(Collectors.toList()), "mock"))
                .build());
    }

    TraceListReport toTraceList(RawRecord payload, Map<String, String> params, Instant start, Instant end) {
        List<TraceSummary> traces = normalizer.normalizeTraceSummaries(payload, end).stream()
                .filter(t -> contains(t.getRootSpanServiceName(), params.get("serviceName")))
                .filter(t -> contains(t.getRootSpanOperationName(), params.get("operationName")))
                .filter(t -> matchesStatus(t, params.get("status")))
                .filter(t -> t.getRootSpanDurationMs() >= Long.parseLong(params.get("minDuration")))
                .sorted(ordering(params.get("sortBy"), params.get("sortOrder")))
                .collect(Collectors.toList());
        return new TraceListReport(traces, traces.size(), params, start, end);
    }

    TraceDetail toTraceDetail(String traceKey, RawRecord trace) {
        List<SpanRecord> spans = normalizer.normalizeSpans(trace.records("spans"), traceKey);
        SpanHierarchy hierarchy = hierarchy(traceKey, spans);
        return TraceDetail.builder()
                .traceKey(traceKey)
                .rootSpan(hierarchy.getRootSpan())
                .rootCandidates(hierarchy.getRootCandidates())
                .spans(hierarchy.getSpans())
                .totalDurationMs(hierarchy.getTotalDurationMs())
                .totalSpans(hierarchy.getTotalSpans())
                .errorSpans(hierarchy.getErrorSpans())
                .services(hierarchy.getServices())
                .stages(stageMapper.map(hierarchy.getSpans()))
                .build();
    }

    WorkflowTraceReport toWorkflowReport(RawRecord payload) {
        List<RawRecord> rawTraces = payload.records("traces");
        if (rawTraces.isEmpty() && payload.has("spans")) {
            rawTraces = List.of(payload);
        }
        List<WorkflowExecutionTrace> traces = new ArrayList<>(rawTraces.size());
        for (RawRecord rawTrace : rawTraces) {
            String key = normalizer.traceKey(rawTrace, "unknown");
            List<SpanRecord> spans = normalizer.normalizeSpans(rawTrace.records("spans"), key);
            traces.add(stageMapper.toWorkflowTrace(hierarchy(key, spans)));
        }
        return workflowReport(traces, "apm");
    }

    private SpanHierarchy hierarchy(String traceKey, List<SpanRecord> spans) {
        return hierarchyBuilder.build(traceKey, spans, tracingProperties.getMultipleRootPolicy());
    }

    private WorkflowTraceReport workflowReport(List<WorkflowExecutionTrace> traces, String source) {
        return new WorkflowTraceReport(traces, metrics.workflowSummary(traces), source);
    }

    private String missingDomainSetting() {
        if (!tracingProperties.isDomainConfigured()) {
            return TracingProperties.DOMAIN_SETTING;
        }
        return tracingProperties.isConfigured() ? null : TracingProperties.BASE_URL_SETTING;
    }

    private static boolean contains(String value, String filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return value != null && value.toLowerCase(Locale.ROOT).contains(filter.toLowerCase(Locale.ROOT));
    }

    private static boolean matchesStatus(TraceSummary trace, String status) {
        if ("ERROR".equals(status)) {
            return trace.isFailed();
        }
        if ("OK".equals(status)) {
            return !trace.isFailed();
        }
        return true;
    }

    private static Comparator<TraceSummary> ordering(String sortBy, String sortOrder) {
        Comparator<TraceSummary> comparator = "rootSpanDurationInMs".equalsIgnoreCase(sortBy)
                ? Comparator.comparingDouble(TraceSummary::getRootSpanDurationMs)
                : Comparator.comparing(TraceSummary::getTimeEarliestSpanStarted);
        return "ASC".equals(sortOrder) ? comparator : comparator.reversed();
    }
}

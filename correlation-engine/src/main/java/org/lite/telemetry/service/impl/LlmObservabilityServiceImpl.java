package org.lite.telemetry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.config.CacheProperties;
import org.lite.telemetry.config.TracingProperties;
import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.enums.QueryKind;
import org.lite.telemetry.model.Pagination;
import org.lite.telemetry.model.QualityCheck;
import org.lite.telemetry.model.QualityReport;
import org.lite.telemetry.model.SecurityCheck;
import org.lite.telemetry.model.SecurityReport;
import org.lite.telemetry.service.DemoDataProvider;
import org.lite.telemetry.service.DerivedMetricsCalculator;
import org.lite.telemetry.service.LlmObservabilityService;
import org.lite.telemetry.service.QuerySpec;
import org.lite.telemetry.service.ResilientQueryExecutor;
import org.lite.telemetry.service.SchemaNormalizer;
import org.lite.telemetry.service.TracingClient;
import org.lite.telemetry.util.CacheKeys;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmObservabilityServiceImpl implements LlmObservabilityService {

    static final String DEFAULT_TIME_RANGE = "24h";

    private final TracingClient tracingClient;
    private final TracingProperties tracingProperties;
    private final SchemaNormalizer normalizer;
    private final DerivedMetricsCalculator metrics;
    private final DemoDataProvider demoData;
    private final ResilientQueryExecutor executor;

    @Override
    public Mono<ResultEnvelope<SecurityReport>> security(Map<String, String> filters, int limit, int offset, boolean skipCache) {
        Map<String, String> active = activeFilters(filters);
        int pageLimit = Math.max(0, limit);
        int pageOffset = Math.max(0, offset);
        log.info("Security checks requested with filters {}, limit {}, offset {}", active, pageLimit, pageOffset);

        return executor.execute(QuerySpec.<SecurityReport>builder()
                .kind(QueryKind.SECURITY_CHECKS)
                .cacheName(CacheProperties.SECURITY)
                .cacheKey(cacheKey(active, pageLimit, pageOffset))
                .skipCache(skipCache)
                .missingSetting(tracingProperties.isConfigured() ? null : TracingProperties.BASE_URL_SETTING)
                .demoWhenUnconfigured(true)
                .fetch(() -> tracingClient.listSecurityChecks(active.get("timeRange"))
                        .map(payload -> securityReport(normalizer.normalizeSecurityChecks(payload), active, pageLimit, pageOffset)))
                .emptyPayload(() -> securityReport(List.of(), active, pageLimit, pageOffset))
                .demoPayload(() -> securityReport(demoData.securityChecks(), active, pageLimit, pageOffset))
                .build());
    }

    @Override
    public Mono<ResultEnvelope<QualityReport>> quality(Map<String, String> filters, int limit, int offset, boolean skipCache) {
        Map<String, String> active = activeFilters(filters);
        int pageLimit = Math.max(0, limit);
        int pageOffset = Math.max(0, offset);
        log.info("Quality checks requested with filters {}, limit {}, offset {}", active, pageLimit, pageOffset);

        return executor.execute(QuerySpec.<QualityReport>builder()
                .kind(QueryKind.QUALITY_CHECKS)
                .cacheName(CacheProperties.QUALITY)
                .cacheKey(cacheKey(active, pageLimit, pageOffset))
                .skipCache(skipCache)
                .missingSetting(tracingProperties.isConfigured() ? null : TracingProperties.BASE_URL_SETTING)
                .demoWhenUnconfigured(true)
                .fetch(() -> tracingClient.listQualityChecks(active.get("timeRange"))
                        .map(payload -> qualityReport(normalizer.normalizeQualityChecks(payload), active, pageLimit, pageOffset)))
                .emptyPayload(() -> qualityReport(List.of(), active, pageLimit, pageOffset))
                .demoPayload(() -> qualityReport(demoData.qualityChecks(), active, pageLimit, pageOffset))
                .build());
    }

    SecurityReport securityReport(List<SecurityCheck> all, Map<String, String> filters, int limit, int offset) {
        Predicate<SecurityCheck> matches = check ->
                equalsIfSet(filters.get("checkType"), check.getCheckType())
                        && equalsIfSet(filters.get("severity"), check.getSeverity().getValue())
                        && equalsIfSet(filters.get("detected"), String.valueOf(check.isDetected()))
                        && equalsIfSet(filters.get("location"), check.getLocation())
                        && equalsIfSet(filters.get("traceId"), check.getTraceId())
                        && equalsIfSet(filters.get("model"), check.getModel());
        List<SecurityCheck> filtered = all.stream().filter(matches).collect(Collectors.toList());
        return new SecurityReport(page(filtered, limit, offset), metrics.securitySummary(filtered),
                new Pagination(filtered.size(), limit, offset), filters);
    }

    QualityReport qualityReport(List<QualityCheck> all, Map<String, String> filters, int limit, int offset) {
        Predicate<QualityCheck> matches = check ->
                equalsIfSet(filters.get("checkType"), check.getCheckType())
                        && equalsIfSet(filters.get("severity"), check.getSeverity().getValue())
                        && equalsIfSet(filters.get("passed"), String.valueOf(check.isPassed()))
                        && equalsIfSet(filters.get("traceId"), check.getTraceId())
                        && equalsIfSet(filters.get("model"), check.getModel());
        List<QualityCheck> filtered = all.stream().filter(matches).collect(Collectors.toList());
        return new QualityReport(page(filtered, limit, offset), metrics.qualitySummary(filtered),
                new Pagination(filtered.size(), limit, offset), filters);
    }

    private static <T> List<T> page(List<T> items, int limit, int offset) {
        if (offset >= items.size()) {
            return List.of();
        }
        return new ArrayList<>(items.subList(offset, (int) Math.min(items.size(), (long) offset + limit)));
    }

    private static Map<String, String> activeFilters(Map<String, String> filters) {
        Map<String, String> active = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    active.put(name, value.trim());
                }
            });
        }
        active.putIfAbsent("timeRange", DEFAULT_TIME_RANGE);
        return active;
    }

    private static String cacheKey(Map<String, String> filters, int limit, int offset) {
        Map<String, Object> params = new LinkedHashMap<>(filters);
        params.put("limit", limit);
        params.put("offset", offset);
        return CacheKeys.of(params);
    }

    private static boolean equalsIfSet(String expected, String actual) {
        return expected == null || expected.equalsIgnoreCase(actual);
    }
}

package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.model.QualityReport;
import org.lite.telemetry.model.SecurityReport;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Security and quality check results for LLM traffic. Filters are applied first, the summary
 * is computed over everything that matched, and only then is the page cut.
 */
public interface LlmObservabilityService {

    /**
     * Supported filters: {@code checkType}, {@code severity}, {@code detected}, {@code location},
     * {@code traceId}, {@code model}, {@code timeRange}.
     */
    Mono<ResultEnvelope<SecurityReport>> security(Map<String, String> filters, int limit, int offset, boolean skipCache);

    /**
     * Supported filters: {@code checkType}, {@code severity}, {@code passed}, {@code traceId},
     * {@code model}, {@code timeRange}.
     */
    Mono<ResultEnvelope<QualityReport>> quality(Map<String, String> filters, int limit, int offset, boolean skipCache);
}

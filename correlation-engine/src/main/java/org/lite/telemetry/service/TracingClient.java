package org.lite.telemetry.service;

import org.lite.telemetry.model.RawRecord;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Distributed-tracing backend. Every call returns the raw answer for normalization and
 * errors with an exception from {@code org.lite.telemetry.exception} when it cannot.
 */
public interface TracingClient {

    /**
     * Trace summaries whose first span started in {@code [start, end)}.
     */
    Mono<RawRecord> listTraces(Instant start, Instant end, int limit);

    Mono<RawRecord> getTrace(String traceKey);

    /**
     * Recent coordinator pipeline traces with their spans, or a single one when
     * {@code traceKey} is set.
     */
    Mono<RawRecord> listWorkflowTraces(int limit, String traceKey);

    Mono<RawRecord> listSecurityChecks(String timeRange);

    Mono<RawRecord> listQualityChecks(String timeRange);
}

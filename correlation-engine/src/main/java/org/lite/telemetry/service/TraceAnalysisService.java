package org.lite.telemetry.service;

import org.lite.telemetry.dto.ResultEnvelope;
import org.lite.telemetry.dto.TraceListQuery;
import org.lite.telemetry.model.TraceBatchReport;
import org.lite.telemetry.model.TraceDetail;
import org.lite.telemetry.model.TraceListReport;
import org.lite.telemetry.model.WorkflowTraceReport;
import reactor.core.publisher.Mono;

import java.util.List;

public interface TraceAnalysisService {

    Mono<ResultEnvelope<TraceListReport>> listTraces(TraceListQuery query, boolean skipCache);

    Mono<ResultEnvelope<TraceDetail>> getTraceDetail(String traceKey, boolean skipCache);

    /**
     * Detail for up to the configured batch size of traces, each with its own status. The
     * batch is {@code connected} when any trace is.
     */
    Mono<ResultEnvelope<TraceBatchReport>> getTraceDetails(List<String> traceKeys, boolean skipCache);

    Mono<ResultEnvelope<WorkflowTraceReport>> getWorkflowTraces(int limit, String traceKey, boolean skipCache);
}

package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TraceDetail {
    String traceKey;
    SpanRecord rootSpan;
    int rootCandidates;
    List<SpanRecord> spans;
    double totalDurationMs;
    int totalSpans;
    int errorSpans;
    List<String> services;
    List<StageExecution> stages;

    public static TraceDetail empty(String traceKey) {
        return TraceDetail.builder()
                .traceKey(traceKey)
                .spans(List.of())
                .services(List.of())
                .stages(List.of())
                .build();
    }
}

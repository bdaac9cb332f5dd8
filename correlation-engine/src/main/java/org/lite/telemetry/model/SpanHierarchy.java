package org.lite.telemetry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Spans of one trace with the root resolved. {@code childrenIndex} maps a parent span key to
 * the keys of its direct children, in input order.
 */
@Value
@Builder
public class SpanHierarchy {
    String traceKey;
    SpanRecord rootSpan;
    int rootCandidates;
    List<SpanRecord> spans;
    @JsonIgnore
    Map<String, List<String>> childrenIndex;
    double totalDurationMs;
    int errorSpans;
    List<String> services;

    public int getTotalSpans() {
        return spans.size();
    }
}

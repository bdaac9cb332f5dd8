package org.lite.telemetry.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
public class TraceListReport {
    List<TraceSummary> traces;
    int totalCount;
    Map<String, String> params;
    Instant timeRangeStart;
    Instant timeRangeEnd;
}

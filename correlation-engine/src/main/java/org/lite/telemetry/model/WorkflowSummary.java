package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowSummary {
    int traceCount;
    double totalDurationMs;
    double averageDurationMs;
    int errorCount;
    double errorRate;
}

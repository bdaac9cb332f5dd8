package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TraceSummary {
    String traceKey;
    String rootSpanServiceName;
    String rootSpanOperationName;
    Instant timeEarliestSpanStarted;
    Instant timeLatestSpanEnded;
    double rootSpanDurationMs;
    String traceStatus;
    String traceErrorType;
    int spanCount;
    int errorSpanCount;

    public boolean isFailed() {
        return errorSpanCount > 0 || "ERROR".equalsIgnoreCase(traceStatus);
    }
}

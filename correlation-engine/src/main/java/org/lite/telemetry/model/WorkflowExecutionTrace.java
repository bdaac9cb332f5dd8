package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.TraceStatus;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class WorkflowExecutionTrace {
    String traceKey;
    List<StageExecution> stages;
    TraceStatus status;
    double totalDurationMs;
    Instant startTime;
    Instant endTime;
    String routingType;
    String query;
    String response;
}

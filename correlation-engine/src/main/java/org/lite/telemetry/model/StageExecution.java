package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.PipelineStage;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of every span matched to one pipeline stage.
 */
@Value
@Builder
public class StageExecution {
    PipelineStage stage;
    String stageName;
    String spanKey;
    List<SpanRecord> spans;
    Instant startTime;
    Instant endTime;
    double durationMs;
    boolean error;
    List<ToolCall> toolCalls;
}

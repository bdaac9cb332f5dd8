package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.Severity;

import java.time.Instant;

@Value
@Builder
public class QualityCheck {
    String checkId;
    String traceId;
    String spanId;
    String checkType;
    double score;
    boolean passed;
    Severity severity;
    String details;
    Instant timestamp;
    String model;
}

package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.Severity;

import java.time.Instant;

@Value
@Builder
public class SecurityCheck {
    String checkId;
    String traceId;
    String spanId;
    String checkType;
    boolean detected;
    Severity severity;
    double confidence;
    String location;
    String details;
    Instant timestamp;
    String remediation;
    String model;
    boolean blocked;
}

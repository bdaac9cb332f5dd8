package org.lite.telemetry.model;

import lombok.Value;

@Value
public class ToolCall {
    String toolName;
    double durationMs;
    String status;
}

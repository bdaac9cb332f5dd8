package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DopDowngrade {
    String timestamp;
    String sqlId;
    int requestedDop;
    int actualDop;
    String reason;
    long qcSid;
}

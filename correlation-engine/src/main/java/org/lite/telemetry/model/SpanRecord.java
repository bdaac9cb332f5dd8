package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class SpanRecord {
    String spanKey;
    String parentSpanKey;
    String traceKey;
    String spanName;
    String serviceName;
    String operationName;
    Instant timeStarted;
    Instant timeEnded;
    double durationMs;
    String status;
    String spanKind;
    boolean error;
    String errorMessage;
    Map<String, String> tags;

    public boolean hasParent() {
        return parentSpanKey != null;
    }

    public String tag(String key) {
        return tags != null ? tags.get(key) : null;
    }
}

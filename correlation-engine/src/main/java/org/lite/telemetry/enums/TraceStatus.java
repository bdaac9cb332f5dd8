package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceStatus {
    SUCCESS("success"),
    ERROR("error"),
    PENDING("pending");

    private final String value;

    TraceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

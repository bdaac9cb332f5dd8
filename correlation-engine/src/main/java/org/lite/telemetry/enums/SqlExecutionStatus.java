package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SqlExecutionStatus {
    EXECUTING("EXECUTING"),
    DONE("DONE"),
    DONE_ERROR("DONE (ERROR)"),
    QUEUED("QUEUED");

    private final String value;

    SqlExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SqlExecutionStatus fromValue(String raw) {
        String status = String.valueOf(raw).toUpperCase(Locale.ROOT);
        if (status.contains("EXECUTING") || status.contains("RUNNING")) return EXECUTING;
        if (status.contains("ERROR") || status.contains("FAILED")) return DONE_ERROR;
        if (status.contains("QUEUED") || status.contains("WAITING")) return QUEUED;
        return DONE;
    }
}

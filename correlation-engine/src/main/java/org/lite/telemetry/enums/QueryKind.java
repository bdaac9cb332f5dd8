package org.lite.telemetry.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryKind {
    BLOCKING_SESSIONS,
    SQL_MONITOR,
    PARALLEL_EXECUTION,
    TRACE_LIST,
    TRACE_DETAIL,
    WORKFLOW_TRACES,
    SECURITY_CHECKS,
    QUALITY_CHECKS,
    COORDINATOR_STATUS;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QueryKind fromValue(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}

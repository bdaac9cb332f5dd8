package org.lite.telemetry.dto;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Filters for a trace listing. Out-of-range values are clamped, not rejected.
 */
@Data
public class TraceListQuery {

    public static final double MAX_HOURS = 72;
    public static final int MAX_LIMIT = 200;

    private double hours = 1;
    private int limit = 50;
    private String service = "";
    private String operation = "";
    private String status = "";        // ERROR, OK or empty for all
    private long minDuration;          // milliseconds
    private String sortBy = "timeEarliestSpanStarted";
    private String sortOrder = "DESC";

    public double getEffectiveHours() {
        if (!(hours > 0)) {
            return 1;
        }
        return Math.min(hours, MAX_HOURS);
    }

    public int getEffectiveLimit() {
        if (limit < 1) {
            return 1;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    /**
     * Normalized parameters, used both as the cache key source and echoed in the response.
     */
    public Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("hoursBack", trimNumber(getEffectiveHours()));
        params.put("limit", String.valueOf(getEffectiveLimit()));
        params.put("serviceName", nullToEmpty(service));
        params.put("operationName", nullToEmpty(operation));
        params.put("status", nullToEmpty(status).toUpperCase(Locale.ROOT));
        params.put("minDuration", String.valueOf(Math.max(0, minDuration)));
        params.put("sortBy", nullToEmpty(sortBy));
        params.put("sortOrder", nullToEmpty(sortOrder).toUpperCase(Locale.ROOT));
        return params;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String trimNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}

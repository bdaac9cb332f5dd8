package org.lite.telemetry.model;

import lombok.Value;

@Value
public class SqlMonitorSummary {
    int totalExecuting;
    int totalHung;
    long avgElapsedTime;

    public static SqlMonitorSummary empty() {
        return new SqlMonitorSummary(0, 0, 0);
    }
}

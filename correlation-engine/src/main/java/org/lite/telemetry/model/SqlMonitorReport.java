package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;

@Value
public class SqlMonitorReport {
    String database;
    List<SqlExecution> executions;
    SqlMonitorSummary summary;

    public static SqlMonitorReport empty(String database) {
        return new SqlMonitorReport(database, List.of(), SqlMonitorSummary.empty());
    }
}

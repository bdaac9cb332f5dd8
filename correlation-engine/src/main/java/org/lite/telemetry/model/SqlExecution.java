package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.SqlExecutionStatus;

@Value
@Builder(toBuilder = true)
public class SqlExecution {
    String sqlId;
    long sqlExecId;
    SqlExecutionStatus status;
    String username;
    String sqlText;
    double elapsedTimeSecs;
    double cpuTimeSecs;
    long bufferGets;
    long diskReads;
    long rowsProcessed;
    int dop;
    int pxServersAllocated;
    String lastRefreshTime;
    Double velocity; // rows per second, absent when elapsed time is zero
    boolean hung;
}

package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;
import org.lite.telemetry.enums.PxSessionStatus;

/**
 * A parallel-execution query coordinator and the degree of parallelism it asked for and got.
 */
@Value
@Builder
public class PxSession {
    long qcSid;
    long qcSerial;
    String sqlId;
    String username;
    int requestedDop;
    int actualDop;
    int serversAllocated;
    int serversBusy;
    double elapsedSeconds;
    PxSessionStatus status;

    public boolean isDowngraded() {
        return actualDop < requestedDop;
    }
}

package org.lite.telemetry.model;

import lombok.Value;

@Value
public class PxSystemStats {
    int maxParallelServers;
    int serversInUse;
}

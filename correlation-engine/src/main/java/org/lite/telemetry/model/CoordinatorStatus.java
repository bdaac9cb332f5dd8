package org.lite.telemetry.model;

import lombok.Value;

import java.util.Map;

@Value
public class CoordinatorStatus {
    String state; // running | offline
    Map<String, Boolean> mcpServers;
    int toolsCount;

    public static CoordinatorStatus offline() {
        return new CoordinatorStatus("offline", Map.of(), 0);
    }
}

package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParallelismReport {
    String database;
    List<PxSession> sessions;
    List<DopDowngrade> recentDowngrades;
    int maxParallelServers;
    int serversInUse;
    int serversAvailable;
    int activePxSessions;
    double dopEfficiencyPercent;

    public static ParallelismReport empty(String database) {
        return ParallelismReport.builder()
                .database(database)
                .sessions(List.of())
                .recentDowngrades(List.of())
                .dopEfficiencyPercent(0)
                .build();
    }
}

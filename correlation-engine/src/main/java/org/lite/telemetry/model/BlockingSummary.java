package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BlockingSummary {
    int totalBlocked;
    int rootBlockers;
    long maxWaitTime;
    List<String> affectedUsers;

    public static BlockingSummary empty() {
        return new BlockingSummary(0, 0, 0, List.of());
    }
}

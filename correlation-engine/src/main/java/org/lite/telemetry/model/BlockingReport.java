package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BlockingReport {
    String database;
    List<BlockingSession> sessions;
    List<BlockingTreeNode> tree;
    BlockingSummary summary;

    public static BlockingReport empty(String database) {
        return new BlockingReport(database, List.of(), List.of(), BlockingSummary.empty());
    }
}

package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;

/**
 * Forest of blocking chains plus the flat chain in discovery (depth-first) order.
 */
@Value
public class BlockingTree {
    List<BlockingTreeNode> roots;
    List<BlockingSession> chain;
    int cyclesBroken;

    public static BlockingTree empty() {
        return new BlockingTree(List.of(), List.of(), 0);
    }
}

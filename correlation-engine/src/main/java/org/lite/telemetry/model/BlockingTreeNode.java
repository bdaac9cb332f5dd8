package org.lite.telemetry.model;

import lombok.Value;

import java.util.List;

@Value
public class BlockingTreeNode {
    BlockingSession session;
    List<BlockingTreeNode> children;
}

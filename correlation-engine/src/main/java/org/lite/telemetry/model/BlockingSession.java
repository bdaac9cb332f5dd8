package org.lite.telemetry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A blocked or blocking database session. Identity is {@code sid@instance}; a session is a
 * root blocker iff it is not waiting on another session.
 */
@Value
@Builder(toBuilder = true)
public class BlockingSession {
    long sid;
    long serial;
    int instId;
    String username;
    String sqlId;
    String waitEvent;
    long waitTimeSecs;
    Long blockingSession;
    Integer blockingInstance;
    int level;
    boolean orphaned; // waits on a session that is absent from the snapshot, or sits in a cycle

    public String getIdentityKey() {
        return identityKey(sid, instId);
    }

    public String getBlockedBy() {
        if (blockingSession == null) {
            return null;
        }
        return identityKey(blockingSession, blockingInstance != null ? blockingInstance : 1);
    }

    public boolean isRoot() {
        return blockingSession == null;
    }

    public static String identityKey(long sid, int instId) {
        return sid + "@" + instId;
    }
}

package org.lite.telemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.telemetry.model.BlockingSession;
import org.lite.telemetry.model.BlockingTree;
import org.lite.telemetry.model.BlockingTreeNode;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds blocking chains from a flat session snapshot.
 *
 * <p>Roots are sessions that wait on nobody. Every other session hangs under the session it
 * waits on, one level deeper. Sessions that cannot be reached from a root (their blocker is
 * missing from the snapshot, or they wait on each other in a cycle) start their own tree at
 * level 0 and are flagged orphaned. A session is never visited twice, which breaks cycles.
 */
@Component
@Slf4j
public class DependencyTreeBuilder {

    public BlockingTree build(List<BlockingSession> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return BlockingTree.empty();
        }

        // Later records replace earlier ones with the same identity.
        Map<String, BlockingSession> byIdentity = new LinkedHashMap<>();
        for (BlockingSession session : sessions) {
            byIdentity.put(session.getIdentityKey(), session);
        }

        Map<String, List<BlockingSession>> waitersByBlocker = new LinkedHashMap<>();
        for (BlockingSession session : byIdentity.values()) {
            if (!session.isRoot()) {
                waitersByBlocker.computeIfAbsent(session.getBlockedBy(), k -> new ArrayList<>()).add(session);
            }
        }

        Traversal traversal = new Traversal(waitersByBlocker);
        List<BlockingTreeNode> roots = new ArrayList<>();
        for (BlockingSession session : byIdentity.values()) {
            if (session.isRoot()) {
                roots.add(traversal.descend(session, 0, false));
            }
        }
        for (BlockingSession session : byIdentity.values()) {
            if (!session.isRoot() && !traversal.visited.contains(session.getIdentityKey())) {
                log.debug("Session {} waits on {} which is not reachable from any root blocker",
                        session.getIdentityKey(), session.getBlockedBy());
                roots.add(traversal.descend(session, 0, true));
            }
        }

        if (traversal.cyclesBroken > 0) {
            log.warn("Blocking snapshot contains {} wait cycle(s); affected sessions reported as orphaned trees",
                    traversal.cyclesBroken);
        }
        return new BlockingTree(Collections.unmodifiableList(roots),
                Collections.unmodifiableList(traversal.chain), traversal.cyclesBroken);
    }

    private static final class Traversal {
        private final Map<String, List<BlockingSession>> waitersByBlocker;
        private final Set<String> visited = new HashSet<>();
        private final List<BlockingSession> chain = new ArrayList<>();
        private int cyclesBroken;

        private Traversal(Map<String, List<BlockingSession>> waitersByBlocker) {
            this.waitersByBlocker = waitersByBlocker;
        }

        /**
         * Pre-order walk over an explicit stack; chain depth is not limited by the thread stack.
         */
        private BlockingTreeNode descend(BlockingSession session, int level, boolean orphaned) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(enter(session, level, orphaned));
            while (true) {
                Frame frame = stack.peek();
                if (frame.waiters.hasNext()) {
                    BlockingSession waiter = frame.waiters.next();
                    if (visited.contains(waiter.getIdentityKey())) {
                        cyclesBroken++;
                    } else {
                        stack.push(enter(waiter, frame.placed.getLevel() + 1, false));
                    }
                    continue;
                }
                stack.pop();
                BlockingTreeNode node = new BlockingTreeNode(frame.placed, Collections.unmodifiableList(frame.children));
                if (stack.isEmpty()) {
                    return node;
                }
                stack.peek().children.add(node);
            }
        }

        private Frame enter(BlockingSession session, int level, boolean orphaned) {
            visited.add(session.getIdentityKey());
            BlockingSession placed = session.toBuilder().level(level).orphaned(orphaned).build();
            chain.add(placed);
            return new Frame(placed, waitersByBlocker.getOrDefault(session.getIdentityKey(), List.of()).iterator());
        }
    }

    private static final class Frame {
        private final BlockingSession placed;
        private final Iterator<BlockingSession> waiters;
        private final List<BlockingTreeNode> children = new ArrayList<>();

        private Frame(BlockingSession placed, Iterator<BlockingSession> waiters) {
            this.placed = placed;
            this.waiters = waiters;
        }
    }
}

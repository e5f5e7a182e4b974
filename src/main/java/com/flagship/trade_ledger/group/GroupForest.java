package com.flagship.trade_ledger.group;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of building a group hierarchy.
 *
 * {@code detachedCycles} lists groups whose parent chain looped back on itself;
 * each was promoted to a root so the forest stays finite.
 */
@Value
public class GroupForest {
    List<GroupNode> roots;
    List<UUID> detachedCycles;

    public int size() {
        return (int) roots.stream().flatMap(GroupNode::flatten).count();
    }

    public boolean hasCycles() {
        return !detachedCycles.isEmpty();
    }
}

package com.flagship.trade_ledger.group;

import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * A group with its direct children, ordered by name.
 */
@Value
public class GroupNode {
    Group group;
    List<GroupNode> children;

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * This node followed by all descendants, depth first.
     */
    public Stream<GroupNode> flatten() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(GroupNode::flatten));
    }
}

package com.flagship.trade_ledger.group;

import lombok.Value;

import java.util.UUID;

/**
 * Domain view of a group. The parent is always a plain identifier.
 */
@Value
public class Group {
    UUID id;
    String name;
    String slug;
    GroupType type;
    UUID parentGroupId;
    boolean predefined;

    public boolean hasParent() {
        return parentGroupId != null;
    }
}

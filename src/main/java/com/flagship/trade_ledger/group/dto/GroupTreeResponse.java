package com.flagship.trade_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.group.GroupForest;
import com.flagship.trade_ledger.group.GroupType;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class GroupTreeResponse {

    @JsonProperty("type")
    GroupType type;

    @JsonProperty("groups")
    List<GroupResponse> groups;

    @JsonProperty("detached_groups")
    List<UUID> detachedGroups;

    public static GroupTreeResponse from(GroupType type, GroupForest forest) {
        return new GroupTreeResponse(type,
            forest.getRoots().stream().map(GroupResponse::from).toList(),
            forest.getDetachedCycles());
    }
}

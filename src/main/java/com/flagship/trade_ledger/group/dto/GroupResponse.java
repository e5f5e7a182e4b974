package com.flagship.trade_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.group.Group;
import com.flagship.trade_ledger.group.GroupNode;
import com.flagship.trade_ledger.group.GroupType;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class GroupResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("slug")
    String slug;

    @JsonProperty("type")
    GroupType type;

    @JsonProperty("parent_group_id")
    UUID parentGroupId;

    @JsonProperty("is_predefined")
    boolean predefined;

    @JsonProperty("children")
    List<GroupResponse> children;

    public static GroupResponse from(Group group) {
        return new GroupResponse(group.getId(), group.getName(), group.getSlug(), group.getType(),
            group.getParentGroupId(), group.isPredefined(), List.of());
    }

    public static GroupResponse from(GroupNode node) {
        Group group = node.getGroup();
        return new GroupResponse(group.getId(), group.getName(), group.getSlug(), group.getType(),
            group.getParentGroupId(), group.isPredefined(),
            node.getChildren().stream().map(GroupResponse::from).toList());
    }
}

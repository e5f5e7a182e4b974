package com.flagship.trade_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * A null parent moves the group to the top level.
 */
@Value
public class MoveGroupRequest {

    @JsonProperty("parent_group_id")
    UUID parentGroupId;
}

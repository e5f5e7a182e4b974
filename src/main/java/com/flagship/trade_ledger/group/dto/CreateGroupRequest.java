package com.flagship.trade_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.group.GroupType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateGroupRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    GroupType type;

    @JsonProperty("parent_group_id")
    UUID parentGroupId;
}

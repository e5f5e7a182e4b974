package com.flagship.trade_ledger.group;

import com.flagship.trade_ledger.group.dto.CreateGroupRequest;
import com.flagship.trade_ledger.group.dto.GroupResponse;
import com.flagship.trade_ledger.group.dto.GroupTreeResponse;
import com.flagship.trade_ledger.group.dto.MoveGroupRequest;
import com.flagship.trade_ledger.support.Actors;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(
            @Valid @RequestBody CreateGroupRequest request,
            @RequestHeader(name = Actors.HEADER, defaultValue = Actors.SYSTEM) String actor) {
        Group group = groupService.createGroup(request.getName(), request.getType(), request.getParentGroupId(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(GroupResponse.from(group));
    }

    @PutMapping("/{id}/parent")
    public ResponseEntity<GroupResponse> moveGroup(
            @PathVariable("id") UUID id,
            @RequestBody MoveGroupRequest request,
            @RequestHeader(name = Actors.HEADER, defaultValue = Actors.SYSTEM) String actor) {
        return ResponseEntity.ok(GroupResponse.from(groupService.moveGroup(id, request.getParentGroupId(), actor)));
    }

    @GetMapping("/tree")
    public ResponseEntity<GroupTreeResponse> getTree(@RequestParam("type") GroupType type) {
        return ResponseEntity.ok(GroupTreeResponse.from(type, groupService.forest(type)));
    }
}

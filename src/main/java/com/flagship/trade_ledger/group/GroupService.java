package com.flagship.trade_ledger.group;

import com.flagship.trade_ledger.exception.GroupHierarchyException;
import com.flagship.trade_ledger.exception.GroupNotFoundException;
import com.flagship.trade_ledger.support.Slugs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Maintains the group hierarchy.
 *
 * Enforced on every change:
 * 1. The parent exists and is active
 * 2. A child has the same type as its parent
 * 3. No group becomes its own ancestor
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private final GroupRepository groupRepository;
    private final GroupTreeBuilder treeBuilder;

    @Transactional
    public Group createGroup(String name, GroupType type, UUID parentGroupId, String actor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Group type is required");
        }
        if (groupRepository.findBySlug(Slugs.slugify(name)).isPresent()) {
            throw new IllegalStateException("Group already exists: " + name.trim());
        }
        if (parentGroupId != null) {
            GroupEntity parent = loadActive(parentGroupId);
            requireSameType(parent, type);
        }

        GroupEntity saved = groupRepository.save(GroupEntity.create(name, type, parentGroupId, actor));
        log.info("Group created: groupId={}, name={}, type={}, parentGroupId={}",
            saved.getId(), saved.getName(), type, parentGroupId);
        return saved.toDomain();
    }

    @Transactional
    public Group moveGroup(UUID groupId, UUID newParentGroupId, String actor) {
        GroupEntity group = loadActive(groupId);
        if (newParentGroupId != null) {
            if (newParentGroupId.equals(groupId)) {
                throw new GroupHierarchyException("Group cannot be its own parent: " + groupId);
            }
            GroupEntity parent = loadActive(newParentGroupId);
            requireSameType(parent, group.getType());
            requireNotDescendant(groupId, newParentGroupId);
        }

        group.moveUnder(newParentGroupId, actor);
        GroupEntity saved = groupRepository.save(group);
        log.info("Group moved: groupId={}, parentGroupId={}", groupId, newParentGroupId);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public GroupForest forest(GroupType type) {
        List<Group> groups = groupRepository.findAllByTypeAndActiveTrueOrderByNameAsc(type).stream()
            .map(GroupEntity::toDomain)
            .toList();
        return treeBuilder.build(groups);
    }

    private GroupEntity loadActive(UUID groupId) {
        return groupRepository.findByIdAndActiveTrue(groupId)
            .orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    private void requireSameType(GroupEntity parent, GroupType childType) {
        if (parent.getType() != childType) {
            throw new GroupHierarchyException(String.format(
                "Group of type %s cannot be placed under %s group '%s'",
                childType, parent.getType(), parent.getName()));
        }
    }

    /**
     * Walks up from the proposed parent; reaching the group itself means the move would loop.
     */
    private void requireNotDescendant(UUID groupId, UUID proposedParentId) {
        Set<UUID> seen = new HashSet<>();
        UUID current = proposedParentId;
        while (current != null && seen.add(current)) {
            if (current.equals(groupId)) {
                throw new GroupHierarchyException("Moving group " + groupId + " under "
                    + proposedParentId + " would create a circular reference");
            }
            current = groupRepository.findById(current)
                .map(GroupEntity::getParentGroupId)
                .orElse(null);
        }
    }
}

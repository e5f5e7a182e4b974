package com.flagship.trade_ledger.group;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Assembles a flat list of groups into a forest keyed by parent id.
 *
 * A group becomes a root when it has no parent or its parent is not part of
 * the input (e.g. the parent belongs to another type or was deactivated).
 * Construction is a single pass over the input plus a name sort of each
 * sibling list.
 *
 * Parent chains that loop are not trusted: one member of each loop (the
 * first by name) is promoted to a root and reported in
 * {@link GroupForest#getDetachedCycles()}.
 */
@Component
@Slf4j
public class GroupTreeBuilder {

    private static final Comparator<Group> BY_NAME =
        Comparator.comparing(Group::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(g -> g.getId().toString());

    public GroupForest build(Collection<Group> groups) {
        Map<UUID, Group> byId = new LinkedHashMap<>();
        for (Group group : groups) {
            if (group != null && group.getId() != null) {
                byId.putIfAbsent(group.getId(), group);
            }
        }

        Map<UUID, List<Group>> childrenByParent = new HashMap<>();
        List<Group> roots = new ArrayList<>();
        for (Group group : byId.values()) {
            UUID parentId = group.getParentGroupId();
            if (parentId == null || !byId.containsKey(parentId)) {
                roots.add(group);
            } else {
                childrenByParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(group);
            }
        }
        childrenByParent.values().forEach(siblings -> siblings.sort(BY_NAME));
        roots.sort(BY_NAME);

        Set<UUID> visited = new HashSet<>();
        List<GroupNode> rootNodes = new ArrayList<>();
        for (Group root : roots) {
            rootNodes.add(attach(root, childrenByParent, visited));
        }

        // Anything not reached from a root hangs off a parent cycle
        List<UUID> detached = new ArrayList<>();
        List<Group> remaining = new ArrayList<>(byId.values());
        remaining.sort(BY_NAME);
        for (Group group : remaining) {
            if (visited.contains(group.getId())) {
                continue;
            }
            Group entry = cycleEntry(group, byId, visited);
            log.warn("Group hierarchy cycle detected; promoting group to root: groupId={}, name={}",
                entry.getId(), entry.getName());
            detached.add(entry.getId());
            rootNodes.add(attach(entry, childrenByParent, visited));
        }

        return new GroupForest(List.copyOf(rootNodes), List.copyOf(detached));
    }

    private GroupNode attach(Group group, Map<UUID, List<Group>> childrenByParent, Set<UUID> visited) {
        visited.add(group.getId());
        List<GroupNode> children = new ArrayList<>();
        for (Group child : childrenByParent.getOrDefault(group.getId(), List.of())) {
            if (!visited.contains(child.getId())) {
                children.add(attach(child, childrenByParent, visited));
            }
        }
        return new GroupNode(group, List.copyOf(children));
    }

    /**
     * Walks up from an unreached group until a group repeats and returns the
     * first-by-name member of the loop.
     */
    private Group cycleEntry(Group start, Map<UUID, Group> byId, Set<UUID> visited) {
        LinkedHashSet<UUID> path = new LinkedHashSet<>();
        Group current = start;
        while (current != null && !visited.contains(current.getId()) && path.add(current.getId())) {
            current = current.getParentGroupId() == null ? null : byId.get(current.getParentGroupId());
        }
        if (current == null || visited.contains(current.getId())) {
            return start;
        }
        UUID loopStart = current.getId();
        List<Group> loop = new ArrayList<>();
        boolean inLoop = false;
        for (UUID id : path) {
            inLoop = inLoop || id.equals(loopStart);
            if (inLoop) {
                loop.add(byId.get(id));
            }
        }
        return loop.stream().min(BY_NAME).orElse(start);
    }
}

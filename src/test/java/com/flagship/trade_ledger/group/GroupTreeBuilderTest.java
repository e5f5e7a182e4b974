package com.flagship.trade_ledger.group;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GroupTreeBuilderTest {

    private final GroupTreeBuilder builder = new GroupTreeBuilder();

    private static Group group(String name, UUID parentId) {
        return new Group(UUID.randomUUID(), name, name.toLowerCase(), GroupType.ASSETS, parentId, false);
    }

    private static Group withParent(Group group, UUID parentId) {
        return new Group(group.getId(), group.getName(), group.getSlug(), group.getType(), parentId, false);
    }

    @Test
    @DisplayName("Children are attached to their parents and sorted by name")
    void testNestedHierarchy() {
        Group assets = group("Current Assets", null);
        Group cash = group("Cash-in-Hand", assets.getId());
        Group bank = group("Bank Accounts", assets.getId());
        Group petty = group("Petty Cash", cash.getId());

        GroupForest forest = builder.build(List.of(petty, cash, bank, assets));

        assertEquals(1, forest.getRoots().size());
        GroupNode root = forest.getRoots().get(0);
        assertEquals("Current Assets", root.getGroup().getName());
        assertEquals(List.of("Bank Accounts", "Cash-in-Hand"),
            root.getChildren().stream().map(n -> n.getGroup().getName()).toList());
        assertEquals("Petty Cash", root.getChildren().get(1).getChildren().get(0).getGroup().getName());
        assertEquals(4, forest.size());
        assertFalse(forest.hasCycles());
    }

    @Test
    @DisplayName("A group whose parent is absent becomes a root")
    void testMissingParentBecomesRoot() {
        Group orphan = group("Loans & Advances", UUID.randomUUID());
        Group fixed = group("Fixed Assets", null);

        GroupForest forest = builder.build(List.of(orphan, fixed));

        assertEquals(List.of("Fixed Assets", "Loans & Advances"),
            forest.getRoots().stream().map(n -> n.getGroup().getName()).toList());
    }

    @Test
    @DisplayName("A parent cycle is broken and reported instead of looping")
    void testCycleIsDetached() {
        Group a = group("Alpha", null);
        Group b = group("Beta", a.getId());
        Group aLooped = withParent(a, b.getId());

        GroupForest forest = builder.build(List.of(aLooped, b));

        assertTrue(forest.hasCycles());
        assertEquals(List.of(a.getId()), forest.getDetachedCycles());
        assertEquals(1, forest.getRoots().size());
        assertEquals("Alpha", forest.getRoots().get(0).getGroup().getName());
        assertEquals(2, forest.size());
    }

    @Test
    @DisplayName("Empty input gives an empty forest")
    void testEmpty() {
        GroupForest forest = builder.build(List.of());

        assertTrue(forest.getRoots().isEmpty());
        assertEquals(0, forest.size());
    }
}

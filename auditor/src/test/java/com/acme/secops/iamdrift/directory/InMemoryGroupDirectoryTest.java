package com.acme.secops.iamdrift.directory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryGroupDirectoryTest {

    @Test
    void shouldKeepFirstGroupOnDuplicateName() throws Exception {
        InMemoryGroupDirectory directory = new InMemoryGroupDirectory(List.of(
            Group.group("g1", "Ops", 3),
            Group.group("g2", "Ops", 8)
        ));

        assertEquals("g1", directory.findByName(GroupKind.GROUP, "Ops").id());
        assertEquals(2, directory.list(GroupKind.GROUP).size());
    }

    @Test
    void shouldSeparateGroupsFromDynamicGroups() throws Exception {
        InMemoryGroupDirectory directory = new InMemoryGroupDirectory(List.of(
            Group.group("g1", "fn-runtime", 1),
            Group.dynamicGroup("dg1", "fn-runtime")
        ));

        assertEquals("dg1", directory.findByName(GroupKind.DYNAMIC_GROUP, "fn-runtime").id());
        assertEquals("g1", directory.findById(GroupKind.GROUP, "g1").id());
        GroupNotFoundException e = assertThrows(GroupNotFoundException.class,
            () -> directory.findById(GroupKind.DYNAMIC_GROUP, "g1"));
        assertEquals("g1", e.reference());
        assertEquals(GroupKind.DYNAMIC_GROUP, e.kind());
    }

    @Test
    void shouldRejectNegativeMemberCount() {
        assertThrows(IllegalArgumentException.class, () -> Group.group("g1", "Ops", -1));
    }
}

package com.acme.secops.iamdrift.directory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class InMemoryGroupDirectory implements GroupDirectory {
    private final Map<GroupKind, List<Group>> byKind = new EnumMap<>(GroupKind.class);
    private final Map<GroupKind, Map<String, Group>> byName = new EnumMap<>(GroupKind.class);
    private final Map<GroupKind, Map<String, Group>> byId = new EnumMap<>(GroupKind.class);

    public InMemoryGroupDirectory(List<Group> groups) {
        Objects.requireNonNull(groups, "groups");
        for (GroupKind kind : GroupKind.values()) {
            byKind.put(kind, new ArrayList<>());
            byName.put(kind, new HashMap<>());
            byId.put(kind, new HashMap<>());
        }
        for (Group group : groups) {
            byKind.get(group.kind()).add(group);
            // first occurrence wins on duplicate names
            byName.get(group.kind()).putIfAbsent(group.name(), group);
            byId.get(group.kind()).putIfAbsent(group.id(), group);
        }
    }

    public static InMemoryGroupDirectory empty() {
        return new InMemoryGroupDirectory(List.of());
    }

    @Override
    public Group findByName(GroupKind kind, String name) throws GroupNotFoundException {
        Group group = name == null ? null : byName.get(kind).get(name);
        if (group == null) {
            throw new GroupNotFoundException(kind, name);
        }
        return group;
    }

    @Override
    public Group findById(GroupKind kind, String id) throws GroupNotFoundException {
        Group group = id == null ? null : byId.get(kind).get(id);
        if (group == null) {
            throw new GroupNotFoundException(kind, id);
        }
        return group;
    }

    @Override
    public List<Group> list(GroupKind kind) {
        return List.copyOf(byKind.get(kind));
    }
}

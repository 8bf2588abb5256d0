package com.acme.secops.iamdrift.directory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Directory group. An empty {@code memberCount} means the count is unknown, which is
 * not the same as a group with zero members. Dynamic groups are rule-based and usually
 * arrive without a count.
 */
public record Group(String id, String name, GroupKind kind, OptionalInt memberCount) {
    public Group {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        memberCount = memberCount == null ? OptionalInt.empty() : memberCount;
        if (memberCount.isPresent() && memberCount.getAsInt() < 0) {
            throw new IllegalArgumentException("memberCount must be >= 0: " + memberCount.getAsInt());
        }
    }

    public static Group group(String id, String name, int memberCount) {
        return new Group(id, name, GroupKind.GROUP, OptionalInt.of(memberCount));
    }

    public static Group dynamicGroup(String id, String name) {
        return new Group(id, name, GroupKind.DYNAMIC_GROUP, OptionalInt.empty());
    }
}

package com.acme.secops.iamdrift.directory;

import java.util.List;

/**
 * Read-only view over the groups and dynamic groups of a tenancy.
 *
 * <p>Name lookups are exact and case-sensitive.
 */
public interface GroupDirectory {
    /**
     * @throws GroupNotFoundException if no group of the given kind has exactly this name
     */
    Group findByName(GroupKind kind, String name) throws GroupNotFoundException;

    /**
     * @throws GroupNotFoundException if no group of the given kind has this id
     */
    Group findById(GroupKind kind, String id) throws GroupNotFoundException;

    /** All groups of the given kind, in collection order. */
    List<Group> list(GroupKind kind);
}

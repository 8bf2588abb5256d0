package com.acme.secops.iamdrift.radius;

import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.GroupKind;
import com.acme.secops.iamdrift.directory.GroupNotFoundException;
import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.policy.SubjectType;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolver with a per-instance cache keyed by group reference. Create one instance per
 * evaluation run; the cache is not thread-safe and never outlives the run.
 */
public final class CachingBlastRadiusResolver implements BlastRadiusResolver {
    private static final Logger LOG = Logger.getLogger(CachingBlastRadiusResolver.class.getName());
    static final String REASON_NOT_FOUND = "group not found in directory (deleted or renamed since the policy was written)";
    static final String REASON_NO_COUNT = "member count unavailable";

    private final Map<GroupRef, BlastRadius> cache = new HashMap<>();
    private int directoryLookups;

    @Override
    public BlastRadius resolve(Grant grant, DirectorySnapshot snapshot) {
        Objects.requireNonNull(grant, "grant");
        Objects.requireNonNull(snapshot, "snapshot");

        SubjectType subjectType = grant.subjectType();
        if (subjectType.isTenancyWide()) {
            return new BlastRadius.Counted(snapshot.activePrincipalCount(), BlastRadius.Source.TENANCY_PRINCIPALS, null);
        }
        if (!subjectType.isNamedGroup()) {
            return new BlastRadius.NotApplicable();
        }

        GroupKind kind = subjectType == SubjectType.DYNAMIC_GROUP ? GroupKind.DYNAMIC_GROUP : GroupKind.GROUP;
        GroupRef ref = new GroupRef(kind, grant.subjectById(), grant.subjectName());
        BlastRadius cached = cache.get(ref);
        if (cached != null) {
            return cached;
        }
        BlastRadius resolved = lookup(ref, snapshot);
        cache.put(ref, resolved);
        return resolved;
    }

    /** Number of directory lookups performed so far; repeated references are served from cache. */
    public int directoryLookups() {
        return directoryLookups;
    }

    private BlastRadius lookup(GroupRef ref, DirectorySnapshot snapshot) {
        directoryLookups++;
        Group group;
        try {
            group = ref.byId()
                ? snapshot.groups().findById(ref.kind(), ref.reference())
                : snapshot.groups().findByName(ref.kind(), ref.reference());
        } catch (GroupNotFoundException e) {
            LOG.fine("Unresolved group reference: " + e.getMessage());
            return new BlastRadius.Unresolved(ref.reference(), REASON_NOT_FOUND);
        }
        if (group.memberCount().isEmpty()) {
            return new BlastRadius.Unresolved(ref.reference(), REASON_NO_COUNT);
        }
        return new BlastRadius.Counted(group.memberCount().getAsInt(), BlastRadius.Source.GROUP_MEMBERSHIP, group.id());
    }

    private record GroupRef(GroupKind kind, boolean byId, String reference) {}
}

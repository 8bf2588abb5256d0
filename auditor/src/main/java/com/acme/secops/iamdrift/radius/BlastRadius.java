package com.acme.secops.iamdrift.radius;

/**
 * Number of principals a grant reaches.
 */
public sealed interface BlastRadius permits BlastRadius.Counted, BlastRadius.Unresolved, BlastRadius.NotApplicable {

    enum Source { GROUP_MEMBERSHIP, TENANCY_PRINCIPALS }

    /** {@code groupId} is null for tenancy-wide subjects. */
    record Counted(int principals, Source source, String groupId) implements BlastRadius {}

    /** The subject names a group that could not be resolved to a member count. */
    record Unresolved(String reference, String reason) implements BlastRadius {}

    /** The subject is not a group (services, unparsed statements). */
    record NotApplicable() implements BlastRadius {}

    /** @return the principal count, or null unless {@link Counted} */
    static Integer countOrNull(BlastRadius radius) {
        return radius instanceof Counted c ? c.principals() : null;
    }
}

package com.acme.secops.iamdrift.directory;

import com.acme.secops.iamdrift.policy.Policy;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete, time-bounded directory and policy data collected before evaluation.
 * Null lists are normalized to empty ones; whether an empty snapshot is acceptable is
 * decided by the engine.
 */
public record DirectorySnapshot(
    String tenancyId,
    String region,
    Instant collectedAt,
    List<Compartment> compartments,
    List<SkippedCompartment> skippedCompartments,
    List<Policy> policies,
    GroupDirectory groups,
    List<User> users,
    int activePrincipalCount
) {
    public DirectorySnapshot {
        tenancyId = tenancyId == null ? "" : tenancyId;
        region = region == null ? "" : region;
        collectedAt = collectedAt == null ? Instant.EPOCH : collectedAt;
        compartments = compartments == null ? List.of() : List.copyOf(compartments);
        skippedCompartments = skippedCompartments == null ? List.of() : List.copyOf(skippedCompartments);
        policies = policies == null ? List.of() : List.copyOf(policies);
        groups = groups == null ? InMemoryGroupDirectory.empty() : groups;
        users = users == null ? List.of() : List.copyOf(users);
        if (activePrincipalCount < 0) {
            throw new IllegalArgumentException("activePrincipalCount must be >= 0: " + activePrincipalCount);
        }
    }

    public Optional<Compartment> compartment(String compartmentId) {
        Objects.requireNonNull(compartmentId, "compartmentId");
        for (Compartment c : compartments) {
            if (c.id().equals(compartmentId)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}

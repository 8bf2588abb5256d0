package com.acme.secops.iamdrift.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured permission expressed by a single policy statement.
 *
 * <p>{@code resourceType} is normalized to lower case; {@code subjectName} keeps the
 * original case and is empty only for tenancy-wide subjects ({@code any-user},
 * {@code any-group}).
 */
public record Grant(
    Verb verb,
    String resourceType,
    SubjectType subjectType,
    String subjectName,
    boolean subjectById,
    Scope scope,
    String condition
) {
    public Grant {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(subjectType, "subjectType");
        Objects.requireNonNull(scope, "scope");
        if (resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType is blank");
        }
        subjectName = subjectName == null ? "" : subjectName;
        if (subjectName.isEmpty() && !subjectType.isTenancyWide()) {
            throw new IllegalArgumentException("subjectName required for " + subjectType.keyword());
        }
        condition = condition == null || condition.isBlank() ? null : condition.trim();
    }

    public Optional<String> conditionClause() {
        return Optional.ofNullable(condition);
    }

    public boolean hasCondition() {
        return condition != null;
    }
}

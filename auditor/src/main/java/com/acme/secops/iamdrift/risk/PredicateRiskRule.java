package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.Grant;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

public record PredicateRiskRule(
    String ruleId,
    Predicate<Grant> predicate,
    Severity severity,
    String rationale
) implements RiskRule {
    public PredicateRiskRule {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(rationale, "rationale");
    }

    @Override
    public Optional<Classification> evaluate(Grant grant) {
        Objects.requireNonNull(grant, "grant");
        return predicate.test(grant)
            ? Optional.of(new Classification(severity, ruleId, rationale))
            : Optional.empty();
    }
}

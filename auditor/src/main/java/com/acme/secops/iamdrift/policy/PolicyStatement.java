package com.acme.secops.iamdrift.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * One statement of one policy, as collected, together with its parse outcome.
 * {@code ordinal} is the position of the statement across the whole snapshot and
 * breaks severity ties in the finding order.
 */
public record PolicyStatement(
    int ordinal,
    String policyId,
    String policyName,
    String compartmentId,
    String compartmentName,
    String raw,
    ParseResult parsed
) {
    public PolicyStatement {
        Objects.requireNonNull(policyId, "policyId");
        Objects.requireNonNull(compartmentId, "compartmentId");
        Objects.requireNonNull(parsed, "parsed");
        policyName = policyName == null ? policyId : policyName;
        compartmentName = compartmentName == null ? compartmentId : compartmentName;
        raw = raw == null ? "" : raw;
    }

    public static PolicyStatement of(int ordinal,
                                     Policy policy,
                                     String compartmentName,
                                     String raw,
                                     StatementParser parser) {
        return new PolicyStatement(
            ordinal,
            policy.id(),
            policy.name(),
            policy.compartmentId(),
            compartmentName,
            raw,
            parser.parse(raw)
        );
    }

    public Optional<Grant> grant() {
        return parsed instanceof ParseResult.Parsed p ? Optional.of(p.grant()) : Optional.empty();
    }
}

package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.SubjectType;
import com.acme.secops.iamdrift.policy.Verb;

import java.util.List;

/**
 * The built-in rule chain, in evaluation order.
 */
public final class StandardRiskRules {
    public static final RiskRule TENANCY_MANAGE_ALL = new PredicateRiskRule(
        "tenancy-manage-all",
        g -> g.verb() == Verb.MANAGE && ResourceFamilies.isAllResources(g.resourceType()) && g.scope().isTenancy(),
        Severity.CRITICAL,
        "tenancy-wide manage-all grant"
    );

    public static final RiskRule ANY_USER_MANAGE = new PredicateRiskRule(
        "any-user-manage",
        g -> g.verb() == Verb.MANAGE && g.subjectType() == SubjectType.ANY_USER,
        Severity.CRITICAL,
        "unscoped principal with manage rights"
    );

    public static final RiskRule SENSITIVE_MANAGE = new PredicateRiskRule(
        "sensitive-manage",
        g -> g.verb() == Verb.MANAGE && ResourceFamilies.isSensitive(g.resourceType()),
        Severity.HIGH,
        "manage rights on an identity or policy resource type"
    );

    public static final RiskRule WILDCARD_GROUP = new PredicateRiskRule(
        "wildcard-group",
        g -> g.subjectType() == SubjectType.ANY_GROUP,
        Severity.HIGH,
        "wildcard group principal"
    );

    public static final RiskRule BROAD_UNCONDITIONED = new PredicateRiskRule(
        "broad-unconditioned",
        g -> g.verb().atLeast(Verb.USE) && !g.hasCondition() && ResourceFamilies.isBroad(g.resourceType()),
        Severity.MEDIUM,
        "broad resource family without a condition clause"
    );

    public static final RiskRule READ_ONLY_OR_CONDITIONED = new PredicateRiskRule(
        "read-only-or-conditioned",
        g -> !g.verb().atLeast(Verb.USE) || g.hasCondition(),
        Severity.LOW,
        "read-only or condition-restricted grant"
    );

    public static final Classification FALLBACK = new Classification(
        Severity.LOW,
        "fallback",
        "no elevated-risk pattern matched."
    );

    private StandardRiskRules() {
    }

    public static List<RiskRule> ordered() {
        return List.of(
            TENANCY_MANAGE_ALL,
            ANY_USER_MANAGE,
            SENSITIVE_MANAGE,
            WILDCARD_GROUP,
            BROAD_UNCONDITIONED,
            READ_ONLY_OR_CONDITIONED
        );
    }
}

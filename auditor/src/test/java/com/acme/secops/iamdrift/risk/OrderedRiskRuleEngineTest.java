package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.policy.IamStatementParser;
import com.acme.secops.iamdrift.policy.ParseResult;
import com.acme.secops.iamdrift.policy.Scope;
import com.acme.secops.iamdrift.policy.SubjectType;
import com.acme.secops.iamdrift.policy.Verb;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderedRiskRuleEngineTest {
    private final OrderedRiskRuleEngine engine = new OrderedRiskRuleEngine();

    @Test
    void shouldRateTenancyManageAllCritical() {
        Classification c = engine.classify(grant("Allow group Admins to manage all-resources in tenancy"));
        assertEquals(Severity.CRITICAL, c.severity());
        assertEquals("tenancy-manage-all", c.ruleId());
    }

    @Test
    void shouldPreferEarlierRuleWhenSeveralMatch() {
        // matches tenancy-manage-all and any-user-manage; rule 1 reports first
        assertEquals("tenancy-manage-all",
            engine.classify(grant("Allow any-user to manage all-resources in tenancy")).ruleId());
        // matches any-user-manage and sensitive-manage
        assertEquals("any-user-manage",
            engine.classify(grant("Allow any-user to manage policies in compartment dev")).ruleId());
    }

    @Test
    void shouldKeepCriticalAboveHighForRuleOneAndThree() {
        Classification first = engine.classify(grant("Allow group Ops to manage all-resources in tenancy"));
        Classification third = engine.classify(grant("Allow group Ops to manage groups in compartment dev"));

        assertEquals(Severity.CRITICAL, first.severity());
        assertEquals(Severity.HIGH, third.severity());
        assertEquals("sensitive-manage", third.ruleId());
    }

    @Test
    void shouldRateWildcardGroupHigh() {
        Classification c = engine.classify(grant("Allow any-group to use instances in compartment dev"));
        assertEquals(Severity.HIGH, c.severity());
        assertEquals("wildcard-group", c.ruleId());
    }

    @Test
    void shouldRateWildcardGroupHighForAnyVerb() {
        Classification read = engine.classify(grant("Allow any-group to read all-resources in tenancy"));
        Classification inspect = engine.classify(grant("Allow group * to inspect all-resources in tenancy"));

        assertEquals(Severity.HIGH, read.severity());
        assertEquals("wildcard-group", read.ruleId());
        assertEquals(Severity.HIGH, inspect.severity());
        assertEquals("wildcard-group", inspect.ruleId());
    }

    @Test
    void shouldClassifyGrantWithoutScope() {
        Classification sensitive = engine.classify(grant("Allow group Admins to manage policies"));
        Classification manageAll = engine.classify(grant("Allow group Admins to manage all-resources"));

        assertEquals(Severity.HIGH, sensitive.severity());
        assertEquals("sensitive-manage", sensitive.ruleId());
        // only an explicit tenancy scope is tenancy-wide
        assertEquals(Severity.MEDIUM, manageAll.severity());
    }

    @Test
    void shouldRateBroadUnconditionedMedium() {
        assertEquals(Severity.MEDIUM,
            engine.classify(grant("Allow group Ops to use object-family in compartment dev")).severity());
        assertEquals(Severity.MEDIUM,
            engine.classify(grant("Allow group Ops to manage all-resources in compartment dev")).severity());
    }

    @Test
    void shouldRateConditionedOrReadOnlyLow() {
        Classification conditioned = engine.classify(
            grant("Allow group Ops to manage object-family in compartment dev where target.bucket.name='logs'"));
        Classification readOnly = engine.classify(grant("Allow group Ops to read all-resources in tenancy"));

        assertEquals(Severity.LOW, conditioned.severity());
        assertEquals("read-only-or-conditioned", conditioned.ruleId());
        assertEquals(Severity.LOW, readOnly.severity());
    }

    @Test
    void shouldFallBackWhenNothingMatches() {
        Classification c = engine.classify(grant("Allow group Ops to use instance-pools in compartment dev"));
        assertSame(StandardRiskRules.FALLBACK, c);
        assertEquals("no elevated-risk pattern matched.", c.rationale());
    }

    @Test
    void shouldHonourCustomRuleOrder() {
        RiskRule sensitiveFirst = StandardRiskRules.SENSITIVE_MANAGE;
        OrderedRiskRuleEngine reordered = new OrderedRiskRuleEngine(
            List.of(sensitiveFirst, StandardRiskRules.ANY_USER_MANAGE), StandardRiskRules.FALLBACK);

        Grant grant = new Grant(Verb.MANAGE, "policies", SubjectType.ANY_USER, "", false, Scope.tenancy(), null);
        assertEquals("sensitive-manage", reordered.classify(grant).ruleId());
        assertEquals("any-user-manage", engine.classify(grant).ruleId());
    }

    @Test
    void shouldExposeStandardOrder() {
        List<String> ids = engine.rules().stream().map(RiskRule::ruleId).toList();
        assertEquals(List.of(
            "tenancy-manage-all",
            "any-user-manage",
            "sensitive-manage",
            "wildcard-group",
            "broad-unconditioned",
            "read-only-or-conditioned"
        ), ids);
    }

    @Test
    void shouldReturnEmptyWhenPredicateDoesNotMatch() {
        Optional<Classification> result = StandardRiskRules.TENANCY_MANAGE_ALL.evaluate(
            grant("Allow group Ops to read buckets in tenancy"));
        assertTrue(result.isEmpty());
    }

    private static Grant grant(String raw) {
        return assertInstanceOf(ParseResult.Parsed.class, new IamStatementParser().parse(raw)).grant();
    }
}

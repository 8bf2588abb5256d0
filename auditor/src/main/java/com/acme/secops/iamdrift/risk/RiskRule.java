package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.Grant;

import java.util.Optional;

/**
 * A single severity rule. Rules are pure: the outcome depends on the grant only.
 */
public interface RiskRule {
    String ruleId();

    /**
     * @return the classification when this rule applies to the grant, otherwise empty
     */
    Optional<Classification> evaluate(Grant grant);
}

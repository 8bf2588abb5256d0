package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.Grant;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * First-match-wins chain over an ordered rule list. Reordering the list changes
 * observable severities.
 */
public final class OrderedRiskRuleEngine implements RiskRuleEngine {
    private final List<RiskRule> rules;
    private final Classification fallback;

    public OrderedRiskRuleEngine() {
        this(StandardRiskRules.ordered(), StandardRiskRules.FALLBACK);
    }

    public OrderedRiskRuleEngine(List<RiskRule> rules, Classification fallback) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public Classification classify(Grant grant) {
        Objects.requireNonNull(grant, "grant");
        for (RiskRule rule : rules) {
            Optional<Classification> match = rule.evaluate(grant);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return fallback;
    }

    public List<RiskRule> rules() {
        return rules;
    }
}

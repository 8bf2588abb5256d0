package com.acme.secops.iamdrift.risk;

import com.acme.secops.iamdrift.policy.Grant;

/**
 * Assigns exactly one severity to a grant.
 *
 * <p>Classification is a pure function of the grant: identical grants always yield
 * identical classifications.
 */
public interface RiskRuleEngine {
    Classification classify(Grant grant);
}

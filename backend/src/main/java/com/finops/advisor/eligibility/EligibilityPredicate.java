package com.finops.advisor.eligibility;

import com.finops.advisor.domain.model.ResourceCandidate;

@FunctionalInterface
public interface EligibilityPredicate {

    EligibilityDecision evaluate(ResourceCandidate candidate);

    default boolean test(ResourceCandidate candidate) {
        return evaluate(candidate).eligible();
    }
}

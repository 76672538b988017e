package com.finops.advisor.remediation;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.eligibility.EligibilityPredicate;

import java.util.Objects;
import java.util.function.Function;

/**
 * Executable descriptor for one action: where candidates come from, how they
 * are filtered and how each one is changed. Immutable once registered.
 *
 * An action whose lister or mutator is not wired in this deployment is kept in
 * the registry but reported as not implementable.
 */
public record RemediationAction(
        RemediationActionType type,
        EligibilityPredicate eligibility,
        ResourceLister lister,
        Function<ResourceCandidate, MutationResult> applyFn
) {
    public RemediationAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(eligibility, "eligibility");
    }

    public boolean implementable() {
        return lister != null && applyFn != null;
    }

    public String actionId() {
        return type.getActionId();
    }
}

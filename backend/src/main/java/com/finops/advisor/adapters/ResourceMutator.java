package com.finops.advisor.adapters;

import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;

import java.util.Set;

/**
 * Applies remediation actions to individual resources.
 *
 * A resource that no longer exists is a failure result, not an exception.
 */
public interface ResourceMutator {

    Set<RemediationActionType> getSupportedActions();

    MutationResult apply(RemediationActionType action, ResourceCandidate candidate);
}

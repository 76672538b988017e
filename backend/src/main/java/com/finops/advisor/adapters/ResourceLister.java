package com.finops.advisor.adapters;

import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;

import java.util.List;

/**
 * Enumerates the live population of one resource kind.
 *
 * Implementations must not cache: every call reflects the provider's current state.
 */
public interface ResourceLister {

    ResourceKind getKind();

    /**
     * List all resources of this kind.
     *
     * @throws ResourceEnumerationException if the population cannot be listed
     */
    List<ResourceCandidate> list();

    /**
     * Fetch the per-resource properties an action needs before eligibility can be
     * decided. Listers whose {@link #list()} already returns everything keep the
     * default. A failure here excludes only this resource from the pass.
     */
    default ResourceCandidate describe(ResourceCandidate candidate, RemediationActionType action) {
        return candidate;
    }
}

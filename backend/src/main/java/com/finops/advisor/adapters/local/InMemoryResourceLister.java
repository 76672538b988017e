package com.finops.advisor.adapters.local;

import com.finops.advisor.adapters.ResourceEnumerationException;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class InMemoryResourceLister implements ResourceLister {

    private final ResourceKind kind;
    private final InMemoryCloudInventory inventory;

    @Override
    public ResourceKind getKind() {
        return kind;
    }

    @Override
    public List<ResourceCandidate> list() {
        if (inventory.listingFails(kind)) {
            throw new ResourceEnumerationException("Simulated listing failure for " + kind);
        }
        return inventory.snapshot(kind);
    }

    @Override
    public ResourceCandidate describe(ResourceCandidate candidate, RemediationActionType action) {
        if (inventory.describeFails(candidate.id())) {
            throw new IllegalStateException("Simulated metadata failure for " + candidate.id());
        }
        return inventory.find(candidate.id())
                .orElseThrow(() -> new IllegalStateException("Resource " + candidate.id() + " no longer exists"));
    }
}

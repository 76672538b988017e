package com.finops.advisor.adapters.local;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.domain.model.BucketAttributes;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.eligibility.InstanceSizing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Applies every action to the in-memory inventory.
 */
@RequiredArgsConstructor
@Slf4j
public class InMemoryResourceMutator implements ResourceMutator {

    private final InMemoryCloudInventory inventory;

    @Override
    public Set<RemediationActionType> getSupportedActions() {
        return EnumSet.allOf(RemediationActionType.class);
    }

    @Override
    public MutationResult apply(RemediationActionType action, ResourceCandidate candidate) {
        String id = candidate.id();
        if (inventory.mutationFails(id)) {
            return MutationResult.failure("Simulated provider error for " + id);
        }

        log.debug("MOCK: {} on {}", action.getActionId(), id);
        return switch (action) {
            case STOP_IDLE_INSTANCES -> update(id, r -> r.toBuilder().state("stopped").build());
            case OPTIMIZE_INSTANCE_TYPES -> resize(id);
            case DELETE_UNUSED_VOLUMES -> inventory.remove(id)
                    ? MutationResult.ok()
                    : MutationResult.failure("Volume " + id + " not found");
            case MIGRATE_GP2_TO_GP3, OPTIMIZE_VOLUME_TYPES ->
                    update(id, r -> r.toBuilder().volumeType("gp3").iops(3000).build());
            case ENABLE_BUCKET_VERSIONING ->
                    update(id, r -> withAttribute(r, BucketAttributes.VERSIONING_STATUS, "Enabled"));
            case ENABLE_BUCKET_LOGGING ->
                    update(id, r -> withAttribute(r, BucketAttributes.LOGGING_ENABLED, "true"));
            case REMOVE_BUCKET_PUBLIC_ACCESS ->
                    update(id, r -> withAttribute(r, BucketAttributes.PUBLIC_ACL_GRANT, "false"));
            case OPTIMIZE_STORAGE_CLASSES -> update(id, r -> r.toBuilder().storageClass("STANDARD_IA").build());
        };
    }

    private MutationResult resize(String id) {
        Optional<String> target = inventory.find(id)
                .flatMap(r -> InstanceSizing.downsizeTarget(r.instanceType()));
        if (target.isEmpty()) {
            return MutationResult.failure("No smaller instance type for " + id);
        }
        return update(id, r -> r.toBuilder().instanceType(target.get()).build());
    }

    private MutationResult update(String id, UnaryOperator<ResourceCandidate> change) {
        return inventory.update(id, change)
                ? MutationResult.ok()
                : MutationResult.failure("Resource " + id + " not found");
    }

    private static ResourceCandidate withAttribute(ResourceCandidate resource, String key, String value) {
        Map<String, String> attributes = new LinkedHashMap<>(resource.attributes());
        attributes.put(key, value);
        return resource.toBuilder().clearAttributes().attributes(attributes).build();
    }
}

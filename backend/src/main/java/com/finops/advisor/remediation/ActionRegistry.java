package com.finops.advisor.remediation;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import com.finops.advisor.eligibility.EligibilityEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Map.entry;

/**
 * Static mapping from advisory check ids and automation ids to executable actions.
 *
 * Several checks can share one action (idle load balancers and idle instances
 * both stop idle instances). Check ids without an entry are informational and
 * have no automation.
 */
@Component
@Slf4j
public class ActionRegistry {

    private static final Map<String, RemediationActionType> CHECK_ACTIONS = Map.ofEntries(
            entry("idleEC2InstanceCheck", RemediationActionType.STOP_IDLE_INSTANCES),
            entry("idleLoadBalancerCheck", RemediationActionType.STOP_IDLE_INSTANCES),
            entry("ec2InstanceCheck", RemediationActionType.OPTIMIZE_INSTANCE_TYPES),
            entry("unusedEBSVolumeCheck", RemediationActionType.DELETE_UNUSED_VOLUMES),
            entry("unattachedEBSVolumeCheck", RemediationActionType.DELETE_UNUSED_VOLUMES),
            entry("eBSgp2Check", RemediationActionType.MIGRATE_GP2_TO_GP3),
            entry("s3BucketVersioningCheck", RemediationActionType.ENABLE_BUCKET_VERSIONING),
            entry("s3BucketLoggingCheck", RemediationActionType.ENABLE_BUCKET_LOGGING),
            entry("s3BucketPublicReadCheck", RemediationActionType.REMOVE_BUCKET_PUBLIC_ACCESS),
            entry("s3StorageOptimizationCheck", RemediationActionType.OPTIMIZE_STORAGE_CLASSES)
    );

    private final Map<RemediationActionType, RemediationAction> actions;

    public ActionRegistry(
            EligibilityEvaluator eligibilityEvaluator,
            Map<ResourceKind, ResourceLister> resourceListers,
            List<ResourceMutator> resourceMutators
    ) {
        Map<RemediationActionType, ResourceMutator> mutators = indexMutators(resourceMutators);
        Map<RemediationActionType, RemediationAction> registered = new EnumMap<>(RemediationActionType.class);

        for (RemediationActionType type : RemediationActionType.values()) {
            ResourceMutator mutator = mutators.get(type);
            Function<ResourceCandidate, MutationResult> applyFn =
                    mutator == null ? null : candidate -> mutator.apply(type, candidate);
            registered.put(type, new RemediationAction(
                    type,
                    eligibilityEvaluator.predicateFor(type),
                    resourceListers.get(type.getResourceKind()),
                    applyFn
            ));
        }

        this.actions = Collections.unmodifiableMap(registered);
        log.info("Action registry initialized: {} of {} actions implementable",
                actions.values().stream().filter(RemediationAction::implementable).count(),
                actions.size());
    }

    /**
     * Resolve an advisory check id. Empty when the check has no automation.
     */
    public Optional<RemediationAction> lookup(String checkId) {
        if (checkId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CHECK_ACTIONS.get(checkId)).map(actions::get);
    }

    /**
     * Resolve an automation id such as {@code delete_unused_volumes}.
     */
    public Optional<RemediationAction> lookupAutomation(String actionId) {
        return RemediationActionType.fromActionId(actionId).map(actions::get);
    }

    /**
     * True iff the check maps to an action that is wired in this deployment.
     */
    public boolean isImplementable(String checkId) {
        return lookup(checkId).map(RemediationAction::implementable).orElse(false);
    }

    public List<AutomationDescriptor> availableAutomations() {
        return Arrays.stream(RemediationActionType.values())
                .map(actions::get)
                .filter(RemediationAction::implementable)
                .map(action -> AutomationDescriptor.of(action.type()))
                .toList();
    }

    public List<String> checkIdsFor(RemediationActionType type) {
        return CHECK_ACTIONS.entrySet().stream()
                .filter(e -> e.getValue() == type)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static Map<RemediationActionType, ResourceMutator> indexMutators(List<ResourceMutator> mutators) {
        Map<RemediationActionType, ResourceMutator> index = new EnumMap<>(RemediationActionType.class);
        for (ResourceMutator mutator : mutators) {
            for (RemediationActionType type : mutator.getSupportedActions()) {
                ResourceMutator previous = index.putIfAbsent(type, mutator);
                if (previous != null && previous != mutator) {
                    throw new IllegalStateException("Multiple mutators registered for " + type.getActionId()
                            + ": " + previous.getClass().getSimpleName()
                            + ", " + mutator.getClass().getSimpleName());
                }
            }
        }
        return index;
    }
}

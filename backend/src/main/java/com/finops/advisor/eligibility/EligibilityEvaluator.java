package com.finops.advisor.eligibility;

import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.BucketAttributes;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a live resource is a candidate for a remediation action.
 *
 * All predicates are pure: they read only the candidate, the clock and the
 * configured thresholds. A property that was never fetched (null attribute)
 * always means "not eligible", so a failed describe can never widen the
 * candidate set.
 *
 * SAFETY RULES:
 * - A production-tagged instance is never stopped or resized
 * - An attached ("in-use") volume is never deleted, whatever its age or tags
 * - A protective tag (protected/keep/important = true/yes/1) excludes instances and volumes
 */
@Component
public class EligibilityEvaluator {

    static final String STATE_RUNNING = "running";
    static final String STATE_AVAILABLE = "available";

    private static final List<String> ENV_TAGS = List.of("environment", "env");
    private static final List<String> PURPOSE_TAGS = List.of("purpose", "role");
    private static final List<String> PROTECTIVE_TAGS = List.of("protected", "keep", "important");

    private static final Set<String> NON_PROD_ENVIRONMENTS = Set.of("dev", "development", "test");
    private static final Set<String> NON_PROD_PURPOSES = Set.of("dev", "test", "staging");
    private static final Set<String> PRODUCTION_ENVIRONMENTS = Set.of("prod", "production", "prd");
    private static final Set<String> TRUTHY = Set.of("true", "yes", "1");
    private static final Set<String> PROVISIONED_IOPS_TYPES = Set.of("io1", "io2");

    private final Clock clock;
    private final RemediationProperties.PolicyProperties policy;
    private final boolean treatAnyPolicyAsPublic;

    public EligibilityEvaluator(Clock clock, RemediationProperties properties) {
        this.clock = clock;
        this.policy = properties.getPolicy();
        this.treatAnyPolicyAsPublic = properties.getS3().isTreatAnyPolicyAsPublic();
    }

    public EligibilityPredicate predicateFor(RemediationActionType action) {
        return switch (action) {
            case STOP_IDLE_INSTANCES -> this::idleInstance;
            case OPTIMIZE_INSTANCE_TYPES -> this::oversizedInstance;
            case DELETE_UNUSED_VOLUMES -> this::unusedVolume;
            case MIGRATE_GP2_TO_GP3 -> this::gp2Volume;
            case OPTIMIZE_VOLUME_TYPES -> this::overprovisionedVolume;
            case ENABLE_BUCKET_VERSIONING -> this::unversionedBucket;
            case ENABLE_BUCKET_LOGGING -> this::unloggedBucket;
            case REMOVE_BUCKET_PUBLIC_ACCESS -> this::publicBucket;
            case OPTIMIZE_STORAGE_CLASSES -> this::standardObject;
        };
    }

    public EligibilityDecision evaluate(RemediationActionType action, ResourceCandidate candidate) {
        if (candidate.kind() != action.getResourceKind()) {
            return EligibilityDecision.rejected("resource kind " + candidate.kind()
                    + " does not match " + action.getResourceKind());
        }
        return predicateFor(action).evaluate(candidate);
    }

    // ---- compute ----

    EligibilityDecision idleInstance(ResourceCandidate instance) {
        if (!STATE_RUNNING.equalsIgnoreCase(instance.state())) {
            return EligibilityDecision.rejected("instance is " + instance.state());
        }
        if (isProductionTagged(instance)) {
            return EligibilityDecision.rejected("production workload");
        }
        if (isProtected(instance)) {
            return EligibilityDecision.rejected("protective tag present");
        }
        if (tagIn(instance, ENV_TAGS, NON_PROD_ENVIRONMENTS)) {
            return EligibilityDecision.eligible("non-production environment tag");
        }
        if (tagIn(instance, PURPOSE_TAGS, NON_PROD_PURPOSES)) {
            return EligibilityDecision.eligible("non-production purpose tag");
        }
        if (InstanceSizing.isBurstable(instance.instanceType())
                && olderThan(instance.createdAt(), policy.getBurstableMinAge())) {
            return EligibilityDecision.eligible("long-running burstable instance");
        }
        return EligibilityDecision.rejected("no idle signal");
    }

    EligibilityDecision oversizedInstance(ResourceCandidate instance) {
        if (!STATE_RUNNING.equalsIgnoreCase(instance.state())) {
            return EligibilityDecision.rejected("instance is " + instance.state());
        }
        if (isProductionTagged(instance) || isProtected(instance)) {
            return EligibilityDecision.rejected("production or protected workload");
        }
        return InstanceSizing.downsizeTarget(instance.instanceType())
                .map(target -> EligibilityDecision.eligible("can downsize to " + target))
                .orElseGet(() -> EligibilityDecision.rejected("no smaller size for " + instance.instanceType()));
    }

    // ---- block volumes ----

    EligibilityDecision unusedVolume(ResourceCandidate volume) {
        if (!STATE_AVAILABLE.equalsIgnoreCase(volume.state())) {
            return EligibilityDecision.rejected("volume is " + volume.state());
        }
        if (!olderThan(volume.createdAt(), policy.getVolumeMinAge())) {
            return EligibilityDecision.rejected("volume younger than " + policy.getVolumeMinAge().toDays() + " days");
        }
        if (volume.snapshotId() != null && !volume.snapshotId().isBlank()) {
            return EligibilityDecision.rejected("snapshot reference " + volume.snapshotId());
        }
        if (isProtected(volume)) {
            return EligibilityDecision.rejected("protective tag present");
        }
        return EligibilityDecision.eligible("detached, old and unprotected");
    }

    EligibilityDecision gp2Volume(ResourceCandidate volume) {
        return "gp2".equalsIgnoreCase(volume.volumeType())
                ? EligibilityDecision.eligible("gp2 volume")
                : EligibilityDecision.rejected("volume type " + volume.volumeType());
    }

    EligibilityDecision overprovisionedVolume(ResourceCandidate volume) {
        String type = lower(volume.volumeType());
        if (PROVISIONED_IOPS_TYPES.contains(type)
                && volume.iops() != null
                && volume.iops() < policy.getLowIopsThreshold()) {
            return EligibilityDecision.eligible(type + " with only " + volume.iops() + " IOPS");
        }
        if ("gp2".equals(type) && volume.sizeInGb() > policy.getLargeGp2SizeGb()) {
            return EligibilityDecision.eligible("large gp2 volume");
        }
        return EligibilityDecision.rejected("volume type already appropriate");
    }

    // ---- buckets and objects ----

    EligibilityDecision unversionedBucket(ResourceCandidate bucket) {
        return bucket.attribute(BucketAttributes.VERSIONING_STATUS)
                .map(status -> "Enabled".equals(status)
                        ? EligibilityDecision.rejected("versioning already enabled")
                        : EligibilityDecision.eligible("versioning is " + status))
                .orElseGet(() -> EligibilityDecision.rejected("versioning status unknown"));
    }

    EligibilityDecision unloggedBucket(ResourceCandidate bucket) {
        return bucket.attribute(BucketAttributes.LOGGING_ENABLED)
                .map(Boolean::parseBoolean)
                .map(enabled -> enabled
                        ? EligibilityDecision.rejected("access logging already enabled")
                        : EligibilityDecision.eligible("access logging disabled"))
                .orElseGet(() -> EligibilityDecision.rejected("logging status unknown"));
    }

    EligibilityDecision publicBucket(ResourceCandidate bucket) {
        Optional<Boolean> aclGrant = bucket.attribute(BucketAttributes.PUBLIC_ACL_GRANT).map(Boolean::parseBoolean);
        Optional<Boolean> policyPresent = bucket.attribute(BucketAttributes.POLICY_PRESENT).map(Boolean::parseBoolean);
        if (aclGrant.isEmpty() && policyPresent.isEmpty()) {
            return EligibilityDecision.rejected("access status unknown");
        }
        if (aclGrant.orElse(false)) {
            return EligibilityDecision.eligible("ACL grants AllUsers");
        }
        if (treatAnyPolicyAsPublic && policyPresent.orElse(false)) {
            return EligibilityDecision.eligible("bucket policy present");
        }
        return EligibilityDecision.rejected("no public grant");
    }

    EligibilityDecision standardObject(ResourceCandidate object) {
        return "STANDARD".equals(object.storageClass())
                ? EligibilityDecision.eligible("STANDARD storage class")
                : EligibilityDecision.rejected("storage class " + object.storageClass());
    }

    // ---- helpers ----

    private boolean olderThan(Instant createdAt, Duration minAge) {
        return createdAt != null && Duration.between(createdAt, clock.instant()).compareTo(minAge) > 0;
    }

    private static boolean isProductionTagged(ResourceCandidate candidate) {
        return tagIn(candidate, ENV_TAGS, PRODUCTION_ENVIRONMENTS);
    }

    private static boolean isProtected(ResourceCandidate candidate) {
        return tagIn(candidate, PROTECTIVE_TAGS, TRUTHY);
    }

    private static boolean tagIn(ResourceCandidate candidate, List<String> keys, Set<String> values) {
        return keys.stream()
                .map(candidate::tag)
                .flatMap(Optional::stream)
                .map(EligibilityEvaluator::lower)
                .anyMatch(values::contains);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

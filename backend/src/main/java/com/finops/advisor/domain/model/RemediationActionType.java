package com.finops.advisor.domain.model;

import com.finops.advisor.savings.SavingsModel;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of remediation actions the engine knows how to execute.
 *
 * Each action targets exactly one resource kind and carries the savings model
 * used to price its candidates. Message phrases take the resource count as
 * their only argument.
 */
public enum RemediationActionType {

    STOP_IDLE_INSTANCES(
            "stop_idle_instances", "Stop Idle EC2 Instances",
            "Stop idle EC2 instances to reduce costs",
            "EC2", RiskLevel.LOW, ResourceKind.COMPUTE_INSTANCE, SavingsModel.COMPUTE_SHUTDOWN,
            "stop %d idle instances", "stopped %d idle instances", "idle instances"),

    OPTIMIZE_INSTANCE_TYPES(
            "optimize_instance_types", "Optimize EC2 Instance Types",
            "Downsize oversized m5/c5 instances by one size",
            "EC2", RiskLevel.HIGH, ResourceKind.COMPUTE_INSTANCE, SavingsModel.INSTANCE_RIGHTSIZING,
            "resize %d instances", "resized %d instances", "oversized instances"),

    DELETE_UNUSED_VOLUMES(
            "delete_unused_volumes", "Delete Unused EBS Volumes",
            "Delete unattached EBS volumes to reduce costs",
            "EBS", RiskLevel.MEDIUM, ResourceKind.BLOCK_VOLUME, SavingsModel.VOLUME_DELETION,
            "delete %d unused volumes", "deleted %d unused volumes", "unused volumes"),

    MIGRATE_GP2_TO_GP3(
            "migrate_gp2_to_gp3", "Migrate GP2 to GP3",
            "Migrate GP2 volumes to GP3 for cost savings",
            "EBS", RiskLevel.LOW, ResourceKind.BLOCK_VOLUME, SavingsModel.GP2_TO_GP3_MIGRATION,
            "migrate %d gp2 volumes to gp3", "migrated %d gp2 volumes to gp3", "gp2 volumes"),

    OPTIMIZE_VOLUME_TYPES(
            "optimize_volume_types", "Optimize EBS Volume Types",
            "Convert low-IOPS io1/io2 and large gp2 volumes to gp3",
            "EBS", RiskLevel.MEDIUM, ResourceKind.BLOCK_VOLUME, SavingsModel.VOLUME_TYPE_OPTIMIZATION,
            "convert %d volumes to gp3", "converted %d volumes to gp3", "overprovisioned volumes"),

    ENABLE_BUCKET_VERSIONING(
            "enable_versioning", "Enable S3 Versioning",
            "Enable versioning on S3 buckets for data protection",
            "S3", RiskLevel.LOW, ResourceKind.OBJECT_BUCKET, SavingsModel.NONE,
            "enable versioning on %d buckets", "enabled versioning on %d buckets",
            "buckets without versioning"),

    ENABLE_BUCKET_LOGGING(
            "enable_logging", "Enable S3 Access Logging",
            "Enable server access logging on S3 buckets",
            "S3", RiskLevel.LOW, ResourceKind.OBJECT_BUCKET, SavingsModel.NONE,
            "enable access logging on %d buckets", "enabled access logging on %d buckets",
            "buckets without access logging"),

    /**
     * Resets the bucket ACL only. A bucket policy is left in place, and while
     * {@code remediation.s3.treat-any-policy-as-public} is set such a bucket stays
     * eligible and is reported again on every run.
     */
    REMOVE_BUCKET_PUBLIC_ACCESS(
            "remove_public_access", "Remove S3 Public Access",
            "Reset public bucket ACLs to private",
            "S3", RiskLevel.MEDIUM, ResourceKind.OBJECT_BUCKET, SavingsModel.NONE,
            "remove public access from %d buckets", "removed public access from %d buckets",
            "public buckets"),

    OPTIMIZE_STORAGE_CLASSES(
            "optimize_storage_classes", "Optimize S3 Storage Classes",
            "Transition STANDARD objects to STANDARD_IA",
            "S3", RiskLevel.LOW, ResourceKind.OBJECT_ENTRY, SavingsModel.STORAGE_CLASS_TRANSITION,
            "transition %d objects to STANDARD_IA", "transitioned %d objects to STANDARD_IA",
            "STANDARD objects");

    private final String actionId;
    private final String displayName;
    private final String description;
    private final String service;
    private final RiskLevel riskLevel;
    private final ResourceKind resourceKind;
    private final SavingsModel savingsModel;
    private final String presentPhrase;
    private final String pastPhrase;
    private final String targetNoun;

    RemediationActionType(
            String actionId,
            String displayName,
            String description,
            String service,
            RiskLevel riskLevel,
            ResourceKind resourceKind,
            SavingsModel savingsModel,
            String presentPhrase,
            String pastPhrase,
            String targetNoun
    ) {
        this.actionId = actionId;
        this.displayName = displayName;
        this.description = description;
        this.service = service;
        this.riskLevel = riskLevel;
        this.resourceKind = resourceKind;
        this.savingsModel = savingsModel;
        this.presentPhrase = presentPhrase;
        this.pastPhrase = pastPhrase;
        this.targetNoun = targetNoun;
    }

    public String getActionId() {
        return actionId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getService() {
        return service;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public SavingsModel getSavingsModel() {
        return savingsModel;
    }

    public String getTargetNoun() {
        return targetNoun;
    }

    /** e.g. "stop 3 idle instances" */
    public String describeIntent(int count) {
        return String.format(presentPhrase, count);
    }

    /** e.g. "stopped 3 idle instances" */
    public String describeResult(int count) {
        return String.format(pastPhrase, count);
    }

    public static Optional<RemediationActionType> fromActionId(String actionId) {
        return Arrays.stream(values())
                .filter(t -> t.actionId.equals(actionId))
                .findFirst();
    }
}

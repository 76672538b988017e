package com.finops.advisor.domain.model;

/**
 * Kinds of cloud resources the engine can enumerate and remediate.
 */
public enum ResourceKind {
    /** EC2 instance */
    COMPUTE_INSTANCE("Compute Instance"),

    /** EBS volume */
    BLOCK_VOLUME("Block Volume"),

    /** S3 bucket */
    OBJECT_BUCKET("Object Bucket"),

    /** Object inside an S3 bucket */
    OBJECT_ENTRY("Object Entry");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

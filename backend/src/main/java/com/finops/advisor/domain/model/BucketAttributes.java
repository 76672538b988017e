package com.finops.advisor.domain.model;

/**
 * Attribute keys carried on {@link ResourceCandidate#attributes()} for buckets.
 * Values are filled in by the lister's describe step; an absent key means the
 * property was not fetched.
 */
public final class BucketAttributes {

    public static final String VERSIONING_STATUS = "versioningStatus";
    public static final String LOGGING_ENABLED = "loggingEnabled";
    public static final String PUBLIC_ACL_GRANT = "publicAclGrant";
    public static final String POLICY_PRESENT = "policyPresent";

    /** Versioning status reported for buckets that never had versioning configured. */
    public static final String UNVERSIONED = "Unversioned";

    private BucketAttributes() {
    }
}

package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.ResourceEnumerationException;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.BucketAttributes;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetBucketAclRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLoggingRequest;
import software.amazon.awssdk.services.s3.model.GetBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.Grant;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.List;

/**
 * Lists S3 buckets. Bucket settings are not part of the listing, so
 * {@link #describe} fetches only the setting the action needs.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class S3BucketLister implements ResourceLister {

    static final String ALL_USERS_URI = "http://acs.amazonaws.com/groups/global/AllUsers";
    private static final String NO_SUCH_BUCKET_POLICY = "NoSuchBucketPolicy";

    private final S3Client s3Client;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.OBJECT_BUCKET;
    }

    @Override
    public List<ResourceCandidate> list() {
        try {
            List<ResourceCandidate> buckets = s3Client.listBuckets(ListBucketsRequest.builder().build())
                    .buckets().stream()
                    .map(b -> ResourceCandidate.builder()
                            .id(b.name())
                            .kind(ResourceKind.OBJECT_BUCKET)
                            .state("active")
                            .createdAt(b.creationDate())
                            .build())
                    .toList();
            log.debug("Listed {} S3 buckets", buckets.size());
            return buckets;
        } catch (SdkException e) {
            log.error("Failed to list S3 buckets: {}", AwsErrors.describe(e));
            throw new ResourceEnumerationException("Failed to list S3 buckets: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public ResourceCandidate describe(ResourceCandidate bucket, RemediationActionType action) {
        String name = bucket.id();
        return switch (action) {
            case ENABLE_BUCKET_VERSIONING -> withAttribute(bucket, BucketAttributes.VERSIONING_STATUS,
                    versioningStatus(name));
            case ENABLE_BUCKET_LOGGING -> withAttribute(bucket, BucketAttributes.LOGGING_ENABLED,
                    String.valueOf(loggingEnabled(name)));
            case REMOVE_BUCKET_PUBLIC_ACCESS -> withAttribute(
                    withAttribute(bucket, BucketAttributes.PUBLIC_ACL_GRANT, String.valueOf(aclGrantsAllUsers(name))),
                    BucketAttributes.POLICY_PRESENT, String.valueOf(policyPresent(name)));
            default -> bucket;
        };
    }

    private String versioningStatus(String bucket) {
        String status = s3Client.getBucketVersioning(
                GetBucketVersioningRequest.builder().bucket(bucket).build()).statusAsString();
        return status == null ? BucketAttributes.UNVERSIONED : status;
    }

    private boolean loggingEnabled(String bucket) {
        return s3Client.getBucketLogging(
                GetBucketLoggingRequest.builder().bucket(bucket).build()).loggingEnabled() != null;
    }

    private boolean aclGrantsAllUsers(String bucket) {
        List<Grant> grants = s3Client.getBucketAcl(GetBucketAclRequest.builder().bucket(bucket).build()).grants();
        return grants.stream()
                .anyMatch(g -> g.grantee() != null && ALL_USERS_URI.equals(g.grantee().uri()));
    }

    private boolean policyPresent(String bucket) {
        try {
            s3Client.getBucketPolicy(GetBucketPolicyRequest.builder().bucket(bucket).build());
            return true;
        } catch (S3Exception e) {
            if (AwsErrors.hasErrorCode(e, NO_SUCH_BUCKET_POLICY)) {
                return false;
            }
            throw e;
        }
    }

    private static ResourceCandidate withAttribute(ResourceCandidate bucket, String key, String value) {
        return bucket.toBuilder().attribute(key, value).build();
    }
}

package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.BucketCannedACL;
import software.amazon.awssdk.services.s3.model.BucketLoggingStatus;
import software.amazon.awssdk.services.s3.model.BucketVersioningStatus;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.LoggingEnabled;
import software.amazon.awssdk.services.s3.model.PutBucketAclRequest;
import software.amazon.awssdk.services.s3.model.PutBucketLoggingRequest;
import software.amazon.awssdk.services.s3.model.PutBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.VersioningConfiguration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Applies bucket-level security settings.
 *
 * Access logs go to {@code <bucket><suffix>} under the prefix {@code <bucket>/}.
 * The log bucket is created on first use; one we already own is reused.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@Slf4j
public class S3BucketMutator implements ResourceMutator {

    private final S3Client s3Client;
    private final String region;
    private final String loggingBucketSuffix;

    public S3BucketMutator(
            S3Client s3Client,
            @Value("${aws.region:us-east-1}") String region,
            RemediationProperties properties
    ) {
        this.s3Client = s3Client;
        this.region = region;
        this.loggingBucketSuffix = properties.getS3().getLoggingBucketSuffix();
    }

    @Override
    public Set<RemediationActionType> getSupportedActions() {
        return EnumSet.of(
                RemediationActionType.ENABLE_BUCKET_VERSIONING,
                RemediationActionType.ENABLE_BUCKET_LOGGING,
                RemediationActionType.REMOVE_BUCKET_PUBLIC_ACCESS
        );
    }

    @Override
    public MutationResult apply(RemediationActionType action, ResourceCandidate candidate) {
        String bucket = candidate.id();
        try {
            switch (action) {
                case ENABLE_BUCKET_VERSIONING -> enableVersioning(bucket);
                case ENABLE_BUCKET_LOGGING -> enableLogging(bucket);
                case REMOVE_BUCKET_PUBLIC_ACCESS -> makePrivate(bucket);
                default -> {
                    return MutationResult.failure("Unsupported action " + action.getActionId());
                }
            }
            return MutationResult.ok();
        } catch (SdkException e) {
            log.error("S3 {} failed for bucket {}: {}", action.getActionId(), bucket, AwsErrors.describe(e));
            return MutationResult.failure(AwsErrors.describe(e));
        }
    }

    private void enableVersioning(String bucket) {
        s3Client.putBucketVersioning(PutBucketVersioningRequest.builder()
                .bucket(bucket)
                .versioningConfiguration(VersioningConfiguration.builder()
                        .status(BucketVersioningStatus.ENABLED)
                        .build())
                .build());
        log.info("Enabled versioning on bucket {}", bucket);
    }

    private void enableLogging(String bucket) {
        String logBucket = bucket + loggingBucketSuffix;
        ensureBucketExists(logBucket);

        s3Client.putBucketLogging(PutBucketLoggingRequest.builder()
                .bucket(bucket)
                .bucketLoggingStatus(BucketLoggingStatus.builder()
                        .loggingEnabled(LoggingEnabled.builder()
                                .targetBucket(logBucket)
                                .targetPrefix(bucket + "/")
                                .build())
                        .build())
                .build());
        log.info("Enabled access logging on bucket {} into {}", bucket, logBucket);
    }

    private void ensureBucketExists(String bucket) {
        CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucket);
        // us-east-1 rejects an explicit location constraint
        if (!Region.US_EAST_1.id().equals(region)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region)
                    .build());
        }
        try {
            s3Client.createBucket(request.build());
            log.info("Created logging bucket {}", bucket);
        } catch (BucketAlreadyOwnedByYouException e) {
            log.debug("Logging bucket {} already exists", bucket);
        }
    }

    private void makePrivate(String bucket) {
        s3Client.putBucketAcl(PutBucketAclRequest.builder()
                .bucket(bucket)
                .acl(BucketCannedACL.PRIVATE)
                .build());
        log.info("Reset ACL to private on bucket {}", bucket);
    }
}

package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.MetadataDirective;
import software.amazon.awssdk.services.s3.model.StorageClass;

import java.util.EnumSet;
import java.util.Set;

/**
 * Changes an object's storage class by copying it onto itself.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class S3ObjectMutator implements ResourceMutator {

    private final S3Client s3Client;

    @Override
    public Set<RemediationActionType> getSupportedActions() {
        return EnumSet.of(RemediationActionType.OPTIMIZE_STORAGE_CLASSES);
    }

    @Override
    public MutationResult apply(RemediationActionType action, ResourceCandidate candidate) {
        if (action != RemediationActionType.OPTIMIZE_STORAGE_CLASSES) {
            return MutationResult.failure("Unsupported action " + action.getActionId());
        }
        String bucket = candidate.bucket();
        if (bucket == null || !candidate.id().startsWith(bucket + "/")) {
            return MutationResult.failure("Object " + candidate.id() + " has no bucket");
        }
        String key = candidate.id().substring(bucket.length() + 1);

        try {
            s3Client.copyObject(CopyObjectRequest.builder()
                    .sourceBucket(bucket)
                    .sourceKey(key)
                    .destinationBucket(bucket)
                    .destinationKey(key)
                    .storageClass(StorageClass.STANDARD_IA)
                    .metadataDirective(MetadataDirective.COPY)
                    .build());
            log.info("Transitioned {} to STANDARD_IA", candidate.id());
            return MutationResult.ok();
        } catch (SdkException e) {
            log.error("Storage class change failed for {}: {}", candidate.id(), AwsErrors.describe(e));
            return MutationResult.failure(AwsErrors.describe(e));
        }
    }
}

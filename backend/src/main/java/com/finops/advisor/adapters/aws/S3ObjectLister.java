package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.ResourceEnumerationException;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists objects across all buckets. Candidate ids are {@code bucket/key}.
 *
 * A bucket that cannot be listed is skipped; only failure to list buckets
 * at all fails the enumeration.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class S3ObjectLister implements ResourceLister {

    private final S3Client s3Client;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.OBJECT_ENTRY;
    }

    @Override
    public List<ResourceCandidate> list() {
        List<Bucket> buckets;
        try {
            buckets = s3Client.listBuckets(ListBucketsRequest.builder().build()).buckets();
        } catch (SdkException e) {
            log.error("Failed to list S3 buckets: {}", AwsErrors.describe(e));
            throw new ResourceEnumerationException("Failed to list S3 buckets: " + AwsErrors.describe(e), e);
        }

        List<ResourceCandidate> objects = new ArrayList<>();
        for (Bucket bucket : buckets) {
            try {
                listBucket(bucket.name(), objects);
            } catch (SdkException e) {
                log.warn("Skipping bucket {}: {}", bucket.name(), AwsErrors.describe(e));
            }
        }
        log.debug("Listed {} S3 objects across {} buckets", objects.size(), buckets.size());
        return objects;
    }

    private void listBucket(String bucket, List<ResourceCandidate> into) {
        String continuationToken = null;
        do {
            ListObjectsV2Response response = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .continuationToken(continuationToken)
                    .build());
            for (S3Object object : response.contents()) {
                into.add(toCandidate(bucket, object));
            }
            continuationToken = Boolean.TRUE.equals(response.isTruncated())
                    ? response.nextContinuationToken()
                    : null;
        } while (continuationToken != null);
    }

    private static ResourceCandidate toCandidate(String bucket, S3Object object) {
        return ResourceCandidate.builder()
                .id(bucket + "/" + object.key())
                .kind(ResourceKind.OBJECT_ENTRY)
                .state("stored")
                .bucket(bucket)
                .storageClass(object.storageClassAsString())
                .sizeBytes(object.size())
                .createdAt(object.lastModified())
                .build();
    }
}

package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.BucketCannedACL;
import software.amazon.awssdk.services.s3.model.BucketVersioningStatus;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.PutBucketAclRequest;
import software.amazon.awssdk.services.s3.model.PutBucketLoggingRequest;
import software.amazon.awssdk.services.s3.model.PutBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3BucketMutatorTest {

    @Mock
    private S3Client s3Client;

    private final ResourceCandidate bucket = ResourceCandidate.builder()
            .id("reports")
            .kind(ResourceKind.OBJECT_BUCKET)
            .state("active")
            .build();

    @Test
    @DisplayName("Enables versioning on the bucket")
    void shouldEnableVersioning() {
        MutationResult result = mutatorIn("us-east-1").apply(RemediationActionType.ENABLE_BUCKET_VERSIONING, bucket);

        ArgumentCaptor<PutBucketVersioningRequest> request = ArgumentCaptor.forClass(PutBucketVersioningRequest.class);
        verify(s3Client).putBucketVersioning(request.capture());
        assertThat(result.success()).isTrue();
        assertThat(request.getValue().bucket()).isEqualTo("reports");
        assertThat(request.getValue().versioningConfiguration().status()).isEqualTo(BucketVersioningStatus.ENABLED);
    }

    @Test
    @DisplayName("Removing public access resets the ACL to private")
    void shouldResetAcl() {
        MutationResult result = mutatorIn("us-east-1").apply(RemediationActionType.REMOVE_BUCKET_PUBLIC_ACCESS, bucket);

        assertThat(result.success()).isTrue();
        verify(s3Client).putBucketAcl(PutBucketAclRequest.builder()
                .bucket("reports")
                .acl(BucketCannedACL.PRIVATE)
                .build());
    }

    @Nested
    @DisplayName("Access logging")
    class AccessLogging {

        @Test
        @DisplayName("Creates the log bucket without a location constraint in us-east-1")
        void shouldCreateLogBucketInUsEast1() {
            // When
            MutationResult result = mutatorIn("us-east-1").apply(RemediationActionType.ENABLE_BUCKET_LOGGING, bucket);

            // Then
            ArgumentCaptor<CreateBucketRequest> create = ArgumentCaptor.forClass(CreateBucketRequest.class);
            verify(s3Client).createBucket(create.capture());
            assertThat(create.getValue().bucket()).isEqualTo("reports-logs");
            assertThat(create.getValue().createBucketConfiguration()).isNull();

            ArgumentCaptor<PutBucketLoggingRequest> logging = ArgumentCaptor.forClass(PutBucketLoggingRequest.class);
            verify(s3Client).putBucketLogging(logging.capture());
            assertThat(logging.getValue().bucketLoggingStatus().loggingEnabled().targetBucket()).isEqualTo("reports-logs");
            assertThat(logging.getValue().bucketLoggingStatus().loggingEnabled().targetPrefix()).isEqualTo("reports/");
            assertThat(result.success()).isTrue();
        }

        @Test
        @DisplayName("Sets the location constraint outside us-east-1")
        void shouldSetLocationConstraintElsewhere() {
            mutatorIn("eu-west-1").apply(RemediationActionType.ENABLE_BUCKET_LOGGING, bucket);

            ArgumentCaptor<CreateBucketRequest> create = ArgumentCaptor.forClass(CreateBucketRequest.class);
            verify(s3Client).createBucket(create.capture());
            assertThat(create.getValue().createBucketConfiguration().locationConstraintAsString()).isEqualTo("eu-west-1");
        }

        @Test
        @DisplayName("Reuses a log bucket we already own")
        void shouldReuseOwnedLogBucket() {
            when(s3Client.createBucket(any(CreateBucketRequest.class)))
                    .thenThrow(BucketAlreadyOwnedByYouException.builder().message("already owned").build());

            MutationResult result = mutatorIn("us-east-1").apply(RemediationActionType.ENABLE_BUCKET_LOGGING, bucket);

            assertThat(result.success()).isTrue();
            verify(s3Client).putBucketLogging(any(PutBucketLoggingRequest.class));
        }

        @Test
        @DisplayName("A log bucket that cannot be created fails this bucket only")
        void shouldFailWhenLogBucketCannotBeCreated() {
            when(s3Client.createBucket(any(CreateBucketRequest.class)))
                    .thenThrow(S3Exception.builder()
                            .awsErrorDetails(AwsErrorDetails.builder()
                                    .errorCode("BucketAlreadyExists")
                                    .errorMessage("name taken")
                                    .build())
                            .statusCode(409)
                            .build());

            MutationResult result = mutatorIn("us-east-1").apply(RemediationActionType.ENABLE_BUCKET_LOGGING, bucket);

            assertThat(result.success()).isFalse();
            assertThat(result.reason()).isEqualTo("BucketAlreadyExists: name taken");
            verify(s3Client, never()).putBucketLogging(any(PutBucketLoggingRequest.class));
        }
    }

    private S3BucketMutator mutatorIn(String region) {
        return new S3BucketMutator(s3Client, region, new RemediationProperties());
    }
}

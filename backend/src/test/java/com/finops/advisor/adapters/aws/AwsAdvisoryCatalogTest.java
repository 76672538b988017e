package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.AdvisoryCatalogException;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.domain.model.CheckCategory;
import com.finops.advisor.domain.model.CheckStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.support.SupportClient;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorCheckResultRequest;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorCheckResultResponse;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorChecksRequest;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorChecksResponse;
import software.amazon.awssdk.services.support.model.SupportException;
import software.amazon.awssdk.services.support.model.TrustedAdvisorCheckDescription;
import software.amazon.awssdk.services.support.model.TrustedAdvisorCheckResult;
import software.amazon.awssdk.services.support.model.TrustedAdvisorResourceDetail;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AwsAdvisoryCatalogTest {

    @Mock
    private SupportClient supportClient;

    private AwsAdvisoryCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new AwsAdvisoryCatalog(supportClient, new RemediationProperties());
    }

    @Nested
    @DisplayName("Check results")
    class CheckResults {

        @Test
        @DisplayName("Maps flagged resources and remembers the listed category")
        void shouldMapResult() {
            // Given
            when(supportClient.describeTrustedAdvisorChecks(any(DescribeTrustedAdvisorChecksRequest.class)))
                    .thenReturn(DescribeTrustedAdvisorChecksResponse.builder()
                            .checks(TrustedAdvisorCheckDescription.builder()
                                    .id("s3BucketPublicReadCheck").name("Bucket Permissions")
                                    .description("Open buckets").category("security").build())
                            .build());
            when(supportClient.describeTrustedAdvisorCheckResult(any(DescribeTrustedAdvisorCheckResultRequest.class)))
                    .thenReturn(DescribeTrustedAdvisorCheckResultResponse.builder()
                            .result(TrustedAdvisorCheckResult.builder()
                                    .checkId("s3BucketPublicReadCheck")
                                    .status("error")
                                    .flaggedResources(TrustedAdvisorResourceDetail.builder()
                                            .resourceId("ref-1").region("us-east-1").status("error")
                                            .metadata("app-assets", "public").build())
                                    .build())
                            .build());
            catalog.listChecks();

            // When
            Optional<AdvisoryFinding> finding = catalog.getCheckResult("s3BucketPublicReadCheck");

            // Then
            assertThat(finding).isPresent();
            assertThat(finding.get().category()).isEqualTo(CheckCategory.SECURITY);
            assertThat(finding.get().status()).isEqualTo(CheckStatus.ERROR);
            assertThat(finding.get().flaggedResourceIds()).containsExactly("app-assets");
        }

        @Test
        @DisplayName("An unknown check id reads as no result")
        void shouldReturnEmptyForUnknownCheck() {
            when(supportClient.describeTrustedAdvisorCheckResult(any(DescribeTrustedAdvisorCheckResultRequest.class)))
                    .thenThrow(supportError("InvalidParameterValueException", 400));

            assertThat(catalog.getCheckResult("noSuchCheck")).isEmpty();
        }

        @Test
        @DisplayName("Other provider errors surface as catalog failures")
        void shouldWrapThrottling() {
            when(supportClient.describeTrustedAdvisorCheckResult(any(DescribeTrustedAdvisorCheckResultRequest.class)))
                    .thenThrow(supportError("Throttling", 400));

            assertThatThrownBy(() -> catalog.getCheckResult("eBSgp2Check"))
                    .isInstanceOf(AdvisoryCatalogException.class)
                    .hasMessageContaining("eBSgp2Check")
                    .hasCauseInstanceOf(SupportException.class);
        }
    }

    @Test
    @DisplayName("Listing failures surface as catalog failures")
    void shouldWrapListingFailure() {
        when(supportClient.describeTrustedAdvisorChecks(any(DescribeTrustedAdvisorChecksRequest.class)))
                .thenThrow(supportError("SubscriptionRequiredException", 400));

        assertThatThrownBy(() -> catalog.listChecks()).isInstanceOf(AdvisoryCatalogException.class);
    }

    private static SupportException supportError(String code, int status) {
        return (SupportException) SupportException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
                .statusCode(status)
                .build();
    }
}

package com.finops.advisor.advisory;

import com.finops.advisor.adapters.AdvisoryCatalog;
import com.finops.advisor.adapters.AdvisoryCatalogException;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.domain.model.CheckCategory;
import com.finops.advisor.domain.model.CheckStatus;
import com.finops.advisor.domain.model.FlaggedResource;
import com.finops.advisor.remediation.ActionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdvisoryRecommendationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private AdvisoryCatalog advisoryCatalog;

    @Mock
    private ActionRegistry actionRegistry;

    private AdvisoryRecommendationService service;

    @BeforeEach
    void setUp() {
        service = new AdvisoryRecommendationService(advisoryCatalog, actionRegistry, new RemediationProperties(), CLOCK);
    }

    @Nested
    @DisplayName("Recommendation Mapping")
    class MappingTests {

        @Test
        @DisplayName("Flagged count drives the estimate and metadata supplies resource ids")
        void shouldMapFinding() {
            // Given
            var check = new AdvisoryCheck("unusedEBSVolumeCheck", "Underutilized EBS Volumes",
                    "Detached volumes", CheckCategory.COST_OPTIMIZATION);
            var finding = new AdvisoryFinding("unusedEBSVolumeCheck", CheckCategory.COST_OPTIMIZATION,
                    CheckStatus.WARNING, List.of(
                            new FlaggedResource("ref-1", "us-east-1", "warning", List.of("vol-1", "us-east-1a")),
                            new FlaggedResource("ref-2", "us-east-1", "warning", List.of("vol-2")),
                            new FlaggedResource("ref-3", "us-east-1", "warning", List.of())));
            when(advisoryCatalog.listChecks()).thenReturn(List.of(check));
            when(advisoryCatalog.getCheckResult("unusedEBSVolumeCheck")).thenReturn(Optional.of(finding));
            when(actionRegistry.isImplementable("unusedEBSVolumeCheck")).thenReturn(true);

            // When
            var summary = service.getRecommendations();

            // Then
            assertThat(summary.totalCount()).isEqualTo(1);
            var rec = summary.recommendations().get(0);
            assertThat(rec.title()).isEqualTo("Underutilized EBS Volumes");
            assertThat(rec.status()).isEqualTo(CheckStatus.WARNING);
            assertThat(rec.canImplement()).isTrue();
            assertThat(rec.estimatedSavings()).isEqualByComparingTo("150.00");
            assertThat(rec.affectedResources()).containsExactly("vol-1", "vol-2", "ref-3");
            assertThat(summary.totalSavings()).isEqualByComparingTo("150.00");
        }

        @Test
        @DisplayName("Informational check without automation cannot be implemented")
        void shouldMarkUnmappedCheckNotImplementable() {
            var check = new AdvisoryCheck("serviceLimitsCheck", null, null, CheckCategory.PERFORMANCE);
            var finding = new AdvisoryFinding("serviceLimitsCheck", CheckCategory.PERFORMANCE, CheckStatus.OK, List.of());
            when(actionRegistry.isImplementable("serviceLimitsCheck")).thenReturn(false);

            var rec = service.toRecommendation(check, finding);

            assertThat(rec.canImplement()).isFalse();
            assertThat(rec.estimatedSavings()).isEqualByComparingTo("0");
            assertThat(rec.title()).isEqualTo("Unknown Check");
            assertThat(rec.description()).isEqualTo("No description available");
        }

        @Test
        @DisplayName("A check whose result cannot be fetched is skipped")
        void shouldSkipFailingCheck() {
            var good = new AdvisoryCheck("eBSgp2Check", "gp2 volumes", "", CheckCategory.COST_OPTIMIZATION);
            var bad = new AdvisoryCheck("brokenCheck", "broken", "", CheckCategory.SECURITY);
            when(advisoryCatalog.listChecks()).thenReturn(List.of(bad, good));
            when(advisoryCatalog.getCheckResult("brokenCheck")).thenThrow(new IllegalStateException("throttled"));
            when(advisoryCatalog.getCheckResult("eBSgp2Check")).thenReturn(Optional.of(
                    new AdvisoryFinding("eBSgp2Check", CheckCategory.COST_OPTIMIZATION, CheckStatus.WARNING, List.of())));

            var summary = service.getRecommendations();

            assertThat(summary.recommendations()).extracting(AdvisoryRecommendation::checkId)
                    .containsExactly("eBSgp2Check");
        }

        @Test
        @DisplayName("Listing failure propagates to the caller")
        void shouldPropagateListingFailure() {
            when(advisoryCatalog.listChecks()).thenThrow(new AdvisoryCatalogException("unreachable", null));

            assertThatThrownBy(() -> service.getRecommendations()).isInstanceOf(AdvisoryCatalogException.class);
        }
    }

    @Nested
    @DisplayName("Catalog Connectivity")
    class ConnectivityTests {

        @Test
        @DisplayName("Reachable catalog reports true")
        void shouldReportReachable() {
            when(advisoryCatalog.listChecks()).thenReturn(List.of());

            assertThat(service.connectivityProbe()).isTrue();
        }

        @Test
        @DisplayName("Failing catalog reports false without throwing")
        void shouldReportUnreachable() {
            when(advisoryCatalog.listChecks()).thenThrow(new AdvisoryCatalogException("no support plan", null));

            assertThat(service.connectivityProbe()).isFalse();
        }

        @Test
        @DisplayName("Health indicator reflects catalog connectivity")
        void shouldExposeHealth() {
            when(advisoryCatalog.listChecks()).thenThrow(new AdvisoryCatalogException("down", null));

            var health = new AdvisoryConnectivityHealthIndicator(service).health();

            assertThat(health.getStatus().getCode()).isEqualTo("DOWN");
        }
    }
}

package com.finops.advisor.advisory;

import com.finops.advisor.adapters.AdvisoryCatalog;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.remediation.ActionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates advisory findings into recommendation records.
 *
 * This is a read path: nothing here mutates resources. Failures fetching a
 * single check result are logged and that check is left out; failure to list
 * checks at all propagates to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvisoryRecommendationService {

    private static final String UNKNOWN_TITLE = "Unknown Check";
    private static final String NO_DESCRIPTION = "No description available";

    private final AdvisoryCatalog advisoryCatalog;
    private final ActionRegistry actionRegistry;
    private final RemediationProperties properties;
    private final Clock clock;

    /**
     * Fetch every check and its current result.
     *
     * @throws com.finops.advisor.adapters.AdvisoryCatalogException if checks cannot be listed
     */
    public RecommendationSummary getRecommendations() {
        List<AdvisoryCheck> checks = advisoryCatalog.listChecks();
        log.info("Fetching results for {} advisory checks", checks.size());

        List<AdvisoryRecommendation> recommendations = new ArrayList<>();
        for (AdvisoryCheck check : checks) {
            try {
                advisoryCatalog.getCheckResult(check.checkId())
                        .map(finding -> toRecommendation(check, finding))
                        .ifPresent(recommendations::add);
            } catch (RuntimeException e) {
                log.warn("Skipping check {}: {}", check.checkId(), e.getMessage());
            }
        }

        BigDecimal totalSavings = recommendations.stream()
                .map(AdvisoryRecommendation::estimatedSavings)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);

        log.info("Built {} recommendations, estimated savings ${}/month", recommendations.size(), totalSavings);
        return new RecommendationSummary(recommendations, recommendations.size(), totalSavings, now());
    }

    /**
     * Fetch the recommendation for a single check, if the check has a result.
     *
     * @throws com.finops.advisor.adapters.AdvisoryCatalogException if the catalog cannot be reached
     */
    public Optional<AdvisoryRecommendation> getRecommendation(String checkId) {
        AdvisoryCheck descriptor = advisoryCatalog.listChecks().stream()
                .filter(c -> c.checkId().equals(checkId))
                .findFirst()
                .orElse(new AdvisoryCheck(checkId, null, null, null));
        return advisoryCatalog.getCheckResult(checkId)
                .map(finding -> toRecommendation(descriptor, finding));
    }

    AdvisoryRecommendation toRecommendation(AdvisoryCheck check, AdvisoryFinding finding) {
        int flagged = finding.flaggedResources().size();
        BigDecimal estimate = properties.getAdvisory().getPerResourceEstimate()
                .multiply(BigDecimal.valueOf(flagged))
                .setScale(2, RoundingMode.HALF_UP);

        return new AdvisoryRecommendation(
                finding.checkId(),
                finding.category(),
                check.name() == null ? UNKNOWN_TITLE : check.name(),
                check.description() == null ? NO_DESCRIPTION : check.description(),
                finding.status(),
                estimate,
                actionRegistry.isImplementable(finding.checkId()),
                finding.flaggedResourceIds(),
                now()
        );
    }

    /**
     * Reachability of the advisory service: true iff listing checks succeeds.
     */
    public boolean connectivityProbe() {
        try {
            advisoryCatalog.listChecks();
            return true;
        } catch (RuntimeException e) {
            log.warn("Advisory catalog unreachable: {}", e.getMessage());
            return false;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}

package com.finops.advisor.scheduler;

import com.finops.advisor.adapters.AdvisoryCatalogException;
import com.finops.advisor.advisory.AdvisoryRecommendation;
import com.finops.advisor.advisory.AdvisoryRecommendationService;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.ImplementationOutcome;
import com.finops.advisor.remediation.RemediationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Scheduled caller that remediates actionable advisory findings.
 *
 * For every implementable recommendation in WARNING or ERROR status, runs a dry
 * run first and applies only when the dry run succeeded and its estimated savings
 * exceed the configured minimum. Security actions report zero savings and so are
 * never applied unattended. With {@code dry-run-only} set (the default) nothing is
 * ever mutated.
 *
 * Disabled unless {@code remediation.automation.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "remediation.automation.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AutomatedRemediationJob {

    private final AdvisoryRecommendationService recommendationService;
    private final RemediationEngine remediationEngine;
    private final RemediationProperties properties;

    @Scheduled(cron = "${remediation.automation.cron:0 0 3 * * *}")
    public void remediateActionableFindings() {
        runOnce();
    }

    RunSummary runOnce() {
        log.info("Starting automated remediation job");

        List<AdvisoryRecommendation> recommendations;
        try {
            recommendations = recommendationService.getRecommendations().recommendations();
        } catch (AdvisoryCatalogException e) {
            log.error("Automated remediation aborted: advisory catalog unavailable", e);
            return new RunSummary(0, 0, 0, 0);
        }

        BigDecimal minSavings = properties.getAutomation().getMinSavings();
        boolean dryRunOnly = properties.getAutomation().isDryRunOnly();

        int evaluated = 0;
        int applied = 0;
        int skipped = 0;
        int failed = 0;

        for (AdvisoryRecommendation rec : recommendations) {
            if (!rec.canImplement() || !rec.status().isActionable()) {
                continue;
            }
            evaluated++;

            ImplementationOutcome dryRun = remediationEngine.execute(rec.checkId(), true);
            if (!dryRun.success()) {
                log.warn("Dry run failed for {}: {}", rec.checkId(), dryRun.message());
                failed++;
                continue;
            }
            if (dryRun.savings().compareTo(minSavings) <= 0) {
                log.debug("Skipping {}: savings ${} not above ${}", rec.checkId(), dryRun.savings(), minSavings);
                skipped++;
                continue;
            }
            if (dryRunOnly) {
                log.info("Would apply {} ({} resources, ${}/month); dry-run-only is set",
                        rec.checkId(), dryRun.affectedResources().size(), dryRun.savings());
                skipped++;
                continue;
            }

            ImplementationOutcome outcome = remediationEngine.execute(rec.checkId(), false);
            if (outcome.success() && !outcome.affectedResources().isEmpty()) {
                applied++;
            } else {
                failed++;
            }
        }

        log.info("Automated remediation complete: {} evaluated, {} applied, {} skipped, {} failed",
                evaluated, applied, skipped, failed);
        return new RunSummary(evaluated, applied, skipped, failed);
    }

    record RunSummary(int evaluated, int applied, int skipped, int failed) {}
}

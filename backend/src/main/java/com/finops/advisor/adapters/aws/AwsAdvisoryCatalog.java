package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.AdvisoryCatalog;
import com.finops.advisor.adapters.AdvisoryCatalogException;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.domain.model.CheckCategory;
import com.finops.advisor.domain.model.CheckStatus;
import com.finops.advisor.domain.model.FlaggedResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.support.SupportClient;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorCheckResultRequest;
import software.amazon.awssdk.services.support.model.DescribeTrustedAdvisorChecksRequest;
import software.amazon.awssdk.services.support.model.TrustedAdvisorCheckDescription;
import software.amazon.awssdk.services.support.model.TrustedAdvisorCheckResult;
import software.amazon.awssdk.services.support.model.TrustedAdvisorResourceDetail;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trusted Advisor implementation of the advisory catalog.
 *
 * Check results do not carry a category, so categories are remembered from
 * the last listing. Requires a Business or Enterprise support plan.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@Slf4j
public class AwsAdvisoryCatalog implements AdvisoryCatalog {

    private static final String UNKNOWN_CHECK = "InvalidParameterValueException";

    private final SupportClient supportClient;
    private final String language;
    private final Map<String, CheckCategory> categories = new ConcurrentHashMap<>();

    public AwsAdvisoryCatalog(SupportClient supportClient, RemediationProperties properties) {
        this.supportClient = supportClient;
        this.language = properties.getAdvisory().getLanguage();
    }

    @Override
    public List<AdvisoryCheck> listChecks() {
        try {
            List<TrustedAdvisorCheckDescription> descriptions = supportClient.describeTrustedAdvisorChecks(
                    DescribeTrustedAdvisorChecksRequest.builder().language(language).build()
            ).checks();

            List<AdvisoryCheck> checks = descriptions.stream()
                    .map(d -> new AdvisoryCheck(
                            d.id(),
                            d.name(),
                            d.description(),
                            CheckCategory.fromProviderValue(d.category())))
                    .toList();
            checks.forEach(c -> categories.put(c.checkId(), c.category()));

            log.info("Retrieved {} Trusted Advisor checks", checks.size());
            return checks;
        } catch (SdkException e) {
            log.error("Failed to list Trusted Advisor checks: {}", AwsErrors.describe(e));
            throw new AdvisoryCatalogException("Failed to list Trusted Advisor checks", e);
        }
    }

    @Override
    public Optional<AdvisoryFinding> getCheckResult(String checkId) {
        TrustedAdvisorCheckResult result;
        try {
            result = supportClient.describeTrustedAdvisorCheckResult(
                    DescribeTrustedAdvisorCheckResultRequest.builder()
                            .checkId(checkId)
                            .language(language)
                            .build()
            ).result();
        } catch (SdkException e) {
            if (AwsErrors.hasErrorCode(e, UNKNOWN_CHECK)) {
                log.debug("Trusted Advisor has no check {}", checkId);
                return Optional.empty();
            }
            log.error("Failed to fetch Trusted Advisor result for {}: {}", checkId, AwsErrors.describe(e));
            throw new AdvisoryCatalogException("Failed to fetch Trusted Advisor result for " + checkId, e);
        }

        if (result == null) {
            return Optional.empty();
        }

        List<FlaggedResource> flagged = result.flaggedResources().stream()
                .map(this::toFlaggedResource)
                .toList();

        return Optional.of(new AdvisoryFinding(
                checkId,
                categories.getOrDefault(checkId, CheckCategory.COST_OPTIMIZATION),
                CheckStatus.fromProviderValue(result.status()),
                flagged
        ));
    }

    private FlaggedResource toFlaggedResource(TrustedAdvisorResourceDetail detail) {
        return new FlaggedResource(detail.resourceId(), detail.region(), detail.status(), detail.metadata());
    }
}

package com.finops.advisor.advisory;

import com.finops.advisor.domain.model.CheckCategory;
import com.finops.advisor.domain.model.CheckStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-side view of one advisory finding.
 *
 * {@code estimatedSavings} is a coarse pre-remediation figure (flagged count x
 * flat estimate), not the priced result of a dry run.
 */
public record AdvisoryRecommendation(
        String checkId,
        CheckCategory category,
        String title,
        String description,
        CheckStatus status,
        BigDecimal estimatedSavings,
        boolean canImplement,
        List<String> affectedResources,
        LocalDateTime lastUpdated
) {
    public AdvisoryRecommendation {
        affectedResources = affectedResources == null ? List.of() : List.copyOf(affectedResources);
    }
}

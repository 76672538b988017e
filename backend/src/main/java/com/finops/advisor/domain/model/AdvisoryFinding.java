package com.finops.advisor.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of a single advisory check for one polling cycle.
 */
public record AdvisoryFinding(
        String checkId,
        CheckCategory category,
        CheckStatus status,
        List<FlaggedResource> flaggedResources
) {
    public AdvisoryFinding {
        Objects.requireNonNull(checkId, "checkId");
        category = category == null ? CheckCategory.COST_OPTIMIZATION : category;
        status = status == null ? CheckStatus.NOT_AVAILABLE : status;
        flaggedResources = flaggedResources == null ? List.of() : List.copyOf(flaggedResources);
    }

    public List<String> flaggedResourceIds() {
        return flaggedResources.stream()
                .map(FlaggedResource::recommendationId)
                .filter(Objects::nonNull)
                .toList();
    }
}

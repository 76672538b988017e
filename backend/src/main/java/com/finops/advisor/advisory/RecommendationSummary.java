package com.finops.advisor.advisory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record RecommendationSummary(
        List<AdvisoryRecommendation> recommendations,
        int totalCount,
        BigDecimal totalSavings,
        LocalDateTime lastRefresh
) {
    public RecommendationSummary {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}

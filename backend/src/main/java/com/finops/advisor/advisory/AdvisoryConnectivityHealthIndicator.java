package com.finops.advisor.advisory;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the advisory catalog is reachable.
 */
@Component("advisoryCatalog")
@RequiredArgsConstructor
public class AdvisoryConnectivityHealthIndicator implements HealthIndicator {

    private final AdvisoryRecommendationService recommendationService;

    @Override
    public Health health() {
        if (recommendationService.connectivityProbe()) {
            return Health.up().withDetail("service", "trusted-advisor").build();
        }
        return Health.down().withDetail("service", "trusted-advisor").build();
    }
}

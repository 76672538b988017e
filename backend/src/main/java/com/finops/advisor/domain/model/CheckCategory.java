package com.finops.advisor.domain.model;

import java.util.Arrays;

/**
 * Advisory check categories as reported by Trusted Advisor.
 */
public enum CheckCategory {
    COST_OPTIMIZATION("cost_optimizing", "Cost Optimization"),
    SECURITY("security", "Security"),
    FAULT_TOLERANCE("fault_tolerance", "Fault Tolerance"),
    PERFORMANCE("performance", "Performance");

    private final String providerValue;
    private final String displayName;

    CheckCategory(String providerValue, String displayName) {
        this.providerValue = providerValue;
        this.displayName = displayName;
    }

    public String getProviderValue() {
        return providerValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve the provider's category string. Unrecognized values are treated
     * as cost optimization, which is where most unmapped checks live.
     */
    public static CheckCategory fromProviderValue(String value) {
        if (value == null) {
            return COST_OPTIMIZATION;
        }
        return Arrays.stream(values())
                .filter(c -> c.providerValue.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(COST_OPTIMIZATION);
    }
}

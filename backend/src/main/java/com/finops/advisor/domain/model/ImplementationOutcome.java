package com.finops.advisor.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Result of one remediation invocation.
 *
 * {@code success} means the pass completed, not that every candidate was fixed.
 * Callers must look at {@code affectedResources} and {@code failedResources} to see
 * what actually changed. Savings are USD per month with two decimals and only
 * cover the affected resources.
 */
public record ImplementationOutcome(
        boolean success,
        String message,
        BigDecimal savings,
        Set<String> affectedResources,
        Map<String, String> failedResources,
        boolean dryRun,
        LocalDateTime executedAt
) {
    public ImplementationOutcome {
        message = message == null ? "" : message;
        savings = (savings == null ? BigDecimal.ZERO : savings).setScale(2, RoundingMode.HALF_UP);
        affectedResources = affectedResources == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(affectedResources));
        failedResources = failedResources == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(failedResources));
    }

    /**
     * Outcome for a check or automation with no registered implementation.
     * This is a normal terminal case for informational checks.
     */
    public static ImplementationOutcome unimplemented(String message, boolean dryRun, LocalDateTime at) {
        return new ImplementationOutcome(false, message, BigDecimal.ZERO, Set.of(), Map.of(), dryRun, at);
    }

    public static ImplementationOutcome failed(String message, boolean dryRun, LocalDateTime at) {
        return new ImplementationOutcome(false, message, BigDecimal.ZERO, Set.of(), Map.of(), dryRun, at);
    }

    public static ImplementationOutcome noneFound(String message, boolean dryRun, LocalDateTime at) {
        return new ImplementationOutcome(true, message, BigDecimal.ZERO, Set.of(), Map.of(), dryRun, at);
    }
}

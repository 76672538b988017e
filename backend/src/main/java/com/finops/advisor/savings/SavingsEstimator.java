package com.finops.advisor.savings;

import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.eligibility.InstanceSizing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Converts a set of candidates into estimated monthly savings.
 *
 * PRICING RULES:
 * - Compute shutdown: flat monthly rate per instance type
 * - Rightsizing: flat monthly saving per family
 * - Volume deletion: size x rate of the volume type
 * - gp2 to gp3: size x (gp2 - gp3)
 * - Type optimization: size x (current - gp3) for io1/io2, size x (gp2 - gp3) for gp2
 * - Storage class: size x (STANDARD - STANDARD_IA), size from bytes / 2^30
 * - Security actions: always zero
 *
 * Never throws. A pricing failure degrades the batch to zero; whether the run
 * succeeded is decided by the executor, not here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SavingsEstimator {

    private static final Set<String> PROVISIONED_IOPS_TYPES = Set.of("io1", "io2");

    private final PricingTable pricingTable;

    public BigDecimal estimate(SavingsModel model, Collection<ResourceCandidate> candidates) {
        if (model == null || candidates == null || candidates.isEmpty() || !model.isCostReducing()) {
            return zero();
        }

        try {
            BigDecimal total = BigDecimal.ZERO;
            for (ResourceCandidate candidate : candidates) {
                total = total.add(estimateOne(model, candidate));
            }
            return total.setScale(2, RoundingMode.HALF_UP);
        } catch (RuntimeException e) {
            log.warn("Savings estimation failed for model {} over {} candidates, reporting 0",
                    model, candidates.size(), e);
            return zero();
        }
    }

    private BigDecimal estimateOne(SavingsModel model, ResourceCandidate candidate) {
        return switch (model) {
            case COMPUTE_SHUTDOWN -> pricingTable.computeMonthlyRate(candidate.instanceType());
            case INSTANCE_RIGHTSIZING -> pricingTable.rightsizingMonthlySaving(
                    InstanceSizing.family(candidate.instanceType()));
            case VOLUME_DELETION -> size(candidate).multiply(
                    pricingTable.volumeRatePerGb(candidate.volumeType()));
            case GP2_TO_GP3_MIGRATION -> size(candidate).multiply(
                    pricingTable.gp2Rate().subtract(pricingTable.gp3Rate()));
            case VOLUME_TYPE_OPTIMIZATION -> typeOptimizationSaving(candidate);
            case STORAGE_CLASS_TRANSITION -> size(candidate).multiply(
                    pricingTable.standardStorageRate().subtract(pricingTable.infrequentAccessStorageRate()));
            case NONE -> BigDecimal.ZERO;
        };
    }

    private BigDecimal typeOptimizationSaving(ResourceCandidate candidate) {
        String type = candidate.volumeType() == null ? "" : candidate.volumeType().toLowerCase(Locale.ROOT);
        if (PROVISIONED_IOPS_TYPES.contains(type)) {
            return size(candidate).multiply(pricingTable.volumeRatePerGb(type).subtract(pricingTable.gp3Rate()));
        }
        if ("gp2".equals(type)) {
            return size(candidate).multiply(pricingTable.gp2Rate().subtract(pricingTable.gp3Rate()));
        }
        return BigDecimal.ZERO;
    }

    private static BigDecimal size(ResourceCandidate candidate) {
        return BigDecimal.valueOf(candidate.sizeInGb());
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    }
}

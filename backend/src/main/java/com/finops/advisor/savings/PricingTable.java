package com.finops.advisor.savings;

import com.finops.advisor.config.RemediationProperties;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Static unit-cost lookup keyed by resource kind and subtype.
 *
 * Rates are USD per month (compute, rightsizing) or USD per GB-month (volume,
 * storage). The table is immutable once built, so a run always sees one
 * consistent set of prices.
 */
public final class PricingTable {

    private static final String GP2 = "gp2";
    private static final String GP3 = "gp3";
    private static final String STANDARD = "STANDARD";
    private static final String STANDARD_IA = "STANDARD_IA";

    private final Map<String, BigDecimal> computeMonthly;
    private final BigDecimal computeDefault;
    private final Map<String, BigDecimal> volumePerGb;
    private final Map<String, BigDecimal> storagePerGb;
    private final Map<String, BigDecimal> rightsizingMonthly;

    private PricingTable(
            Map<String, BigDecimal> computeMonthly,
            BigDecimal computeDefault,
            Map<String, BigDecimal> volumePerGb,
            Map<String, BigDecimal> storagePerGb,
            Map<String, BigDecimal> rightsizingMonthly
    ) {
        this.computeMonthly = normalize(computeMonthly, false);
        this.computeDefault = Objects.requireNonNull(computeDefault, "computeDefault");
        this.volumePerGb = normalize(volumePerGb, false);
        this.storagePerGb = normalize(storagePerGb, true);
        this.rightsizingMonthly = normalize(rightsizingMonthly, false);

        if (!this.volumePerGb.containsKey(GP2) || !this.volumePerGb.containsKey(GP3)) {
            throw new IllegalArgumentException("Volume pricing must define gp2 and gp3 rates");
        }
        if (!this.storagePerGb.containsKey(STANDARD) || !this.storagePerGb.containsKey(STANDARD_IA)) {
            throw new IllegalArgumentException("Storage pricing must define STANDARD and STANDARD_IA rates");
        }
    }

    public static PricingTable from(RemediationProperties.PricingProperties pricing) {
        return new PricingTable(
                pricing.getCompute(),
                pricing.getComputeDefault(),
                pricing.getVolume(),
                pricing.getStorage(),
                pricing.getRightsizing()
        );
    }

    /**
     * Built-in rates, used when no configuration is supplied.
     */
    public static PricingTable defaults() {
        return from(new RemediationProperties.PricingProperties());
    }

    /** Monthly cost of an instance type; unknown types use the default rate. */
    public BigDecimal computeMonthlyRate(String instanceType) {
        if (instanceType == null) {
            return computeDefault;
        }
        return computeMonthly.getOrDefault(instanceType.toLowerCase(Locale.ROOT), computeDefault);
    }

    /** Per GB-month rate of a volume type; unknown types use the gp2 rate. */
    public BigDecimal volumeRatePerGb(String volumeType) {
        if (volumeType == null) {
            return volumePerGb.get(GP2);
        }
        return volumePerGb.getOrDefault(volumeType.toLowerCase(Locale.ROOT), volumePerGb.get(GP2));
    }

    public BigDecimal gp2Rate() {
        return volumePerGb.get(GP2);
    }

    public BigDecimal gp3Rate() {
        return volumePerGb.get(GP3);
    }

    public BigDecimal standardStorageRate() {
        return storagePerGb.get(STANDARD);
    }

    public BigDecimal infrequentAccessStorageRate() {
        return storagePerGb.get(STANDARD_IA);
    }

    /** Flat monthly saving for downsizing one step within a family; zero when unpriced. */
    public BigDecimal rightsizingMonthlySaving(String family) {
        if (family == null) {
            return BigDecimal.ZERO;
        }
        return rightsizingMonthly.getOrDefault(family.toLowerCase(Locale.ROOT), BigDecimal.ZERO);
    }

    private static Map<String, BigDecimal> normalize(Map<String, BigDecimal> rates, boolean upperCase) {
        if (rates == null) {
            return Map.of();
        }
        return rates.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(
                        e -> upperCase
                                ? e.getKey().toUpperCase(Locale.ROOT)
                                : e.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (a, b) -> b
                ));
    }
}

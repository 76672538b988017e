package com.finops.advisor.eligibility;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Instance type parsing and the one-step downsize table used for rightsizing.
 */
public final class InstanceSizing {

    /** Families eligible for automated rightsizing */
    public static final Set<String> RIGHTSIZABLE_FAMILIES = Set.of("m5", "c5");

    private static final Set<String> BURSTABLE_FAMILIES = Set.of("t2", "t3");

    private static final Map<String, String> ONE_SIZE_DOWN = Map.of(
            "xlarge", "large",
            "2xlarge", "xlarge",
            "4xlarge", "2xlarge"
    );

    private InstanceSizing() {
    }

    /** "m5.xlarge" -> "m5" */
    public static String family(String instanceType) {
        if (instanceType == null) {
            return "";
        }
        String normalized = instanceType.toLowerCase(Locale.ROOT);
        int dot = normalized.indexOf('.');
        return dot < 0 ? normalized : normalized.substring(0, dot);
    }

    public static boolean isBurstable(String instanceType) {
        return BURSTABLE_FAMILIES.contains(family(instanceType));
    }

    /**
     * Next smaller type in the same family, or empty when the family is not
     * rightsizable or the instance is already at the smallest supported size.
     */
    public static Optional<String> downsizeTarget(String instanceType) {
        String family = family(instanceType);
        if (!RIGHTSIZABLE_FAMILIES.contains(family)) {
            return Optional.empty();
        }
        String normalized = instanceType.toLowerCase(Locale.ROOT);
        if (normalized.length() <= family.length()) {
            return Optional.empty();
        }
        String size = normalized.substring(family.length() + 1);
        return Optional.ofNullable(ONE_SIZE_DOWN.get(size))
                .map(smaller -> family + "." + smaller);
    }
}

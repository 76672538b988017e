package com.finops.advisor.eligibility;

/**
 * Eligibility verdict for one resource and one action. The reason is for logs only.
 */
public record EligibilityDecision(boolean eligible, String reason) {

    public static EligibilityDecision eligible(String reason) {
        return new EligibilityDecision(true, reason);
    }

    public static EligibilityDecision rejected(String reason) {
        return new EligibilityDecision(false, reason);
    }
}

package com.finops.advisor.remediation;

/**
 * Phases of a single remediation pass. There is no retry: a pass moves forward
 * once and ends in DONE.
 */
public enum ExecutionPhase {
    LISTING,
    EVALUATING,
    DRY_RUN_REPORT,
    APPLYING,
    AGGREGATING,
    DONE
}

package com.finops.advisor.savings;

/**
 * How monthly savings are derived for an action's candidates.
 */
public enum SavingsModel {
    /** Flat monthly rate per instance type */
    COMPUTE_SHUTDOWN(true),

    /** Flat monthly rate per instance family when downsizing one step */
    INSTANCE_RIGHTSIZING(true),

    /** size x per-GB rate of the volume type */
    VOLUME_DELETION(true),

    /** size x (gp2 - gp3) */
    GP2_TO_GP3_MIGRATION(true),

    /** size x (current type - gp3) */
    VOLUME_TYPE_OPTIMIZATION(true),

    /** size x (STANDARD - STANDARD_IA) */
    STORAGE_CLASS_TRANSITION(true),

    /** Security and compliance actions, always zero */
    NONE(false);

    private final boolean costReducing;

    SavingsModel(boolean costReducing) {
        this.costReducing = costReducing;
    }

    public boolean isCostReducing() {
        return costReducing;
    }
}

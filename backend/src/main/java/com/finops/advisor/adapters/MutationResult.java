package com.finops.advisor.adapters;

/**
 * Per-resource mutation result. Mutators report failures through this type
 * instead of throwing, so one resource never aborts a batch.
 */
public record MutationResult(boolean success, String reason) {

    public static MutationResult ok() {
        return new MutationResult(true, null);
    }

    public static MutationResult failure(String reason) {
        return new MutationResult(false, reason == null ? "unknown error" : reason);
    }
}

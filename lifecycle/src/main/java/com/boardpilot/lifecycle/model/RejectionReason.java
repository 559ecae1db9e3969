package com.boardpilot.lifecycle.model;

/**
 * Stable reason codes for a rejected trigger.
 *
 * Codes flagged {@code countsAgainstCeiling} increment the task's
 * failed_reactivation_attempts counter and push its cooldown out.
 */
public enum RejectionReason {
    ILLEGAL_TRANSITION(true),
    CONCURRENT_ATTEMPT(false),
    THROTTLED(true),
    MAX_REACTIVATIONS_EXCEEDED(false),
    ALREADY_ACTIVE(true),
    INTERNAL_ERROR(false);

    private final boolean countsAgainstCeiling;

    RejectionReason(boolean countsAgainstCeiling) {
        this.countsAgainstCeiling = countsAgainstCeiling;
    }

    public boolean countsAgainstCeiling() {
        return countsAgainstCeiling;
    }
}

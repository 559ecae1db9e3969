package com.boardpilot.lifecycle.model;

/**
 * Where a reactivation request came from.
 *
 * Superseding triggers carry new information about the task, so an accepted
 * one cancels whatever job is still running for it. RETRY and SCHEDULED only
 * re-kick work that may already be in flight; they are turned away while a
 * live job exists.
 */
public enum TriggerType {
    UPDATE(true),      // new comment / column change on the board item
    MANUAL(true),      // operator action from the admin panel
    RETRY(false),      // job-queue retry of a failed submission
    SCHEDULED(false),  // periodic sweep
    API(true),
    WEBHOOK(true);

    private final boolean supersedesRunningWork;

    TriggerType(boolean supersedesRunningWork) {
        this.supersedesRunningWork = supersedesRunningWork;
    }

    public boolean supersedesRunningWork() {
        return supersedesRunningWork;
    }
}

package com.boardpilot.lifecycle.model;

/**
 * State of one execution attempt of a Task.
 *
 * Transitions:
 *   ACTIVE → COMPLETED  (executor reported the last live job as completed)
 *   ACTIVE → FAILED     (executor reported the last live job as failed)
 *   ACTIVE → CANCELLED  (closed by the consistency audit)
 *
 * Only an ACTIVE run may hold live job ids.
 */
public enum RunStatus {
    ACTIVE,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isClosed() {
        return this != ACTIVE;
    }
}

package com.boardpilot.lifecycle.model;

/** Decision recorded on a ledger entry. PENDING only until the attempt is completed. */
public enum AttemptDecision {
    PENDING,
    ACCEPTED,
    REJECTED
}

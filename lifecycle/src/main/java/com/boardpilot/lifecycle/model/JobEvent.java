package com.boardpilot.lifecycle.model;

/** Lifecycle callbacks the executor sends for a submitted job. */
public enum JobEvent {
    STARTED,
    COMPLETED,
    FAILED
}

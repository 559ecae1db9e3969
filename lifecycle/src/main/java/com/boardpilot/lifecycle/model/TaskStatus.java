package com.boardpilot.lifecycle.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a Task.
 *
 * Legal transitions:
 *   PENDING       → PROCESSING, FAILED
 *   PROCESSING    → TESTING, DEBUGGING, COMPLETED, FAILED
 *   TESTING       → QUALITY_CHECK, DEBUGGING, COMPLETED, FAILED
 *   DEBUGGING     → TESTING, COMPLETED, FAILED
 *   QUALITY_CHECK → COMPLETED, FAILED
 *   COMPLETED     → (terminal)
 *   FAILED        → PENDING, PROCESSING
 *
 * A write that re-asserts the current status is always legal and changes nothing.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    TESTING,
    DEBUGGING,
    QUALITY_CHECK,
    COMPLETED,
    FAILED;

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING,       EnumSet.of(PROCESSING, FAILED));
        TRANSITIONS.put(PROCESSING,    EnumSet.of(TESTING, DEBUGGING, COMPLETED, FAILED));
        TRANSITIONS.put(TESTING,       EnumSet.of(QUALITY_CHECK, DEBUGGING, COMPLETED, FAILED));
        TRANSITIONS.put(DEBUGGING,     EnumSet.of(TESTING, COMPLETED, FAILED));
        TRANSITIONS.put(QUALITY_CHECK, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(COMPLETED,     EnumSet.noneOf(TaskStatus.class));
        TRANSITIONS.put(FAILED,        EnumSet.of(PENDING, PROCESSING));
    }

    /** Statuses reachable in one step from this one (identity not included). */
    public Set<TaskStatus> successors() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canMoveTo(TaskStatus target) {
        return this == target || TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** True while the external workflow is (or should be) doing work for the task. */
    public boolean isActive() {
        return this != COMPLETED && this != FAILED;
    }
}

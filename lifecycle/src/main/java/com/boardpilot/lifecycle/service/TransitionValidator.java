package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.model.TriggerType;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Gatekeeper for every status write.
 *
 * Pure: reads the table on {@link TaskStatus} and never touches the database.
 * Callers perform the write themselves after a successful check.
 */
@Component
public class TransitionValidator {

    // Statuses a MANUAL trigger may restart a COMPLETED task into.
    private static final Set<TaskStatus> REENTRY_TARGETS =
            EnumSet.of(TaskStatus.PENDING, TaskStatus.PROCESSING);

    /**
     * @throws IllegalTransitionException if {@code requested} is not reachable from {@code current}
     */
    public void validate(TaskStatus current, TaskStatus requested) {
        if (!current.canMoveTo(requested)) {
            throw new IllegalTransitionException(current, requested);
        }
    }

    /**
     * Check for a trigger's target status. Like {@link #validate}, but also
     * lets an operator restart finished work: a MANUAL trigger may take a
     * COMPLETED task back to PENDING or PROCESSING.
     *
     * A trigger starts work, so it may never ask for COMPLETED or FAILED.
     * Those are reached only through executor events.
     *
     * @return true when the move is a restart, in which case the caller
     *         must give the task a fresh attempt budget
     * @throws IllegalTransitionException for a finished target or any other
     *         move not in the table
     */
    public boolean validateReentry(TaskStatus current, TaskStatus requested, TriggerType trigger) {
        if (!requested.isActive()) {
            throw new IllegalTransitionException(current, requested);
        }
        if (isRestart(current, requested, trigger)) {
            return true;
        }
        validate(current, requested);
        return false;
    }

    public boolean isRestart(TaskStatus current, TaskStatus requested, TriggerType trigger) {
        return current == TaskStatus.COMPLETED
                && trigger == TriggerType.MANUAL
                && REENTRY_TARGETS.contains(requested);
    }
}

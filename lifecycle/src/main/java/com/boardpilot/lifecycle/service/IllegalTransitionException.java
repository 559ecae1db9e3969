package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.TaskStatus;

/**
 * Thrown when a status write is not in the transition table.
 */
public class IllegalTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTransitionException(TaskStatus from, TaskStatus to) {
        super("Illegal transition " + from + " -> " + to);
        this.from = from;
        this.to   = to;
    }

    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo()   { return to; }
}

package com.boardpilot.lifecycle.service;

import java.util.UUID;

/**
 * Thrown when a request names a task id that was never registered.
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(UUID taskId) {
        super("Task not found: " + taskId);
    }
}

package com.boardpilot.lifecycle.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Handle for a held task lock. Use with try-with-resources so the lock is
 * released on every exit path of the critical section.
 *
 * {@link #close()} never throws: a failed release is logged and left for
 * the sweeper, it must not mask the outcome of the work done under the lock.
 */
public final class TaskLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskLock.class);

    private final LockManager manager;
    private final UUID        taskId;
    private final String      owner;
    private final Instant     acquiredAt;
    private boolean           released;

    TaskLock(LockManager manager, UUID taskId, String owner, Instant acquiredAt) {
        this.manager    = manager;
        this.taskId     = taskId;
        this.owner      = owner;
        this.acquiredAt = acquiredAt;
    }

    public UUID    getTaskId()     { return taskId; }
    public String  getOwner()      { return owner; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public boolean isReleased()    { return released; }

    @Override
    public void close() {
        if (released) return;
        released = true;
        try {
            manager.release(this);
        } catch (RuntimeException e) {
            log.warn("Could not release lock on task {} held by '{}', the sweeper will clear it: {}",
                    taskId, owner, e.getMessage());
        }
    }
}

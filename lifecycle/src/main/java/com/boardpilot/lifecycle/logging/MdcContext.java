package com.boardpilot.lifecycle.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys attached to every log line written while a trigger or executor
 * event is being handled. The console pattern and the structured JSON
 * format both pick them up.
 */
public final class MdcContext {

    public static final String TASK_ID      = "taskId";
    public static final String ATTEMPT_ID   = "attemptId";
    public static final String TRIGGER_TYPE = "triggerType";
    public static final String RUN_ID       = "runId";

    private MdcContext() {}

    public static void putTask(UUID taskId) {
        put(TASK_ID, taskId);
    }

    public static void putAttempt(UUID attemptId, Object triggerType) {
        put(ATTEMPT_ID, attemptId);
        put(TRIGGER_TYPE, triggerType);
    }

    public static void putRun(UUID runId) {
        put(RUN_ID, runId);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(ATTEMPT_ID);
        MDC.remove(TRIGGER_TYPE);
        MDC.remove(RUN_ID);
    }

    private static void put(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }
}

package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.model.TriggerType;

import java.util.UUID;

/**
 * One inbound request to (re)activate a task.
 *
 * The task is named either by internal id or by board item id; a board item
 * seen for the first time is registered on the fly (title is only used then).
 * The payload is kept verbatim for the ledger and forwarded to the executor.
 */
public record TriggerRequest(
        UUID        taskId,
        String      externalId,
        String      title,
        TriggerType triggerType,
        String      triggerSource,
        String      payload,
        TaskStatus  requestedStatus,
        Double      confidenceScore
) {
    // Compact constructor: most triggers just mean "start working on it".
    public TriggerRequest {
        if (triggerType == null) {
            throw new IllegalArgumentException("triggerType is required");
        }
        if (requestedStatus == null) requestedStatus = TaskStatus.PROCESSING;
    }

    public static TriggerRequest forTask(UUID taskId, TriggerType type, String source) {
        return new TriggerRequest(taskId, null, null, type, source, null, null, null);
    }
}

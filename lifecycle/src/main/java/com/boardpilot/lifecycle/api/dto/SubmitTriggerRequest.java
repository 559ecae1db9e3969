package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.model.TriggerType;
import com.boardpilot.lifecycle.service.TriggerRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Request body for POST /triggers.
 *
 * Required: triggerType, and one of taskId / externalId.
 * Optional: requestedStatus (defaults to PROCESSING), triggerSource, title
 *   (used when the board item is seen for the first time), payload (any JSON,
 *   stored verbatim), confidenceScore.
 */
public record SubmitTriggerRequest(
        UUID        taskId,
        String      externalId,
        String      title,
        TriggerType triggerType,
        String      triggerSource,
        JsonNode    payload,
        TaskStatus  requestedStatus,
        Double      confidenceScore
) {
    public TriggerRequest toTriggerRequest() {
        return new TriggerRequest(
                taskId,
                externalId,
                title,
                triggerType,
                triggerSource,
                payload == null || payload.isNull() ? null : payload.toString(),
                requestedStatus,
                confidenceScore);
    }
}

package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.TaskStatus;

/** Request body for PUT /tasks/{id}/status. */
public record StatusUpdateRequest(TaskStatus status) {}

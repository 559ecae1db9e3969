package com.boardpilot.lifecycle.api.dto;

/**
 * Request body for POST /tasks. Both fields are optional; externalId must be
 * unique when given.
 */
public record RegisterTaskRequest(String externalId, String title) {}

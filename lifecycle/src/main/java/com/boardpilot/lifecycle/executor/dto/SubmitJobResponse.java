package com.boardpilot.lifecycle.executor.dto;

/**
 * Response from POST /jobs. Unknown fields are ignored.
 */
public record SubmitJobResponse(String job_id, String state) {}

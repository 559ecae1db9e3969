package com.boardpilot.lifecycle.executor.dto;

import java.util.UUID;

/**
 * Request body for POST /jobs on the executor.
 */
public record SubmitJobRequest(UUID run_id, WorkDescriptor work) {}

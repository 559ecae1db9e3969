package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.JobEvent;

import java.util.UUID;

/**
 * Callback body the executor POSTs to /executor/events.
 * Field names follow the executor's snake_case models.
 */
public record JobEventRequest(String job_id, UUID run_id, JobEvent event) {}

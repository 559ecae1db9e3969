package com.boardpilot.lifecycle.executor.dto;

import java.util.UUID;

/**
 * What the executor should work on. Serialized as the {@code work} field of
 * POST /jobs; field names follow the executor's snake_case models.
 */
public record WorkDescriptor(
        UUID    task_id,
        String  external_id,
        String  title,
        String  target_status,
        String  trigger_type,
        String  payload,
        boolean is_reactivation,
        int     reactivation_number
) {}

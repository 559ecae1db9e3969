package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.api.dto.JobEventRequest;
import com.boardpilot.lifecycle.service.JobEventDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Inbound channel for executor job lifecycle callbacks.
 *
 * Events are queued and applied asynchronously, one at a time per run, so
 * this always answers 202 once the event is well-formed.
 */
@RestController
@RequestMapping("/executor/events")
public class ExecutorEventController {

    private final JobEventDispatcher dispatcher;

    public ExecutorEventController(JobEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void onJobEvent(@RequestBody JobEventRequest req) {
        if (req.run_id() == null || req.job_id() == null || req.event() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "job_id, run_id and event are required");
        }
        dispatcher.dispatch(req.run_id(), req.job_id(), req.event());
    }
}

package com.boardpilot.lifecycle.executor;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.executor.dto.SubmitJobRequest;
import com.boardpilot.lifecycle.executor.dto.SubmitJobResponse;
import com.boardpilot.lifecycle.executor.dto.WorkDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * HTTP client for the asynchronous job executor.
 *
 * Two calls: submit work for a run and get back a job id, or cancel a job by
 * id. Submission happens while the task lock is held, so it carries a short
 * bounded timeout (boardpilot.reactivation.submit-timeout); the executor only
 * has to enqueue the job, not run it.
 */
@Component
public class ExecutorClient {

    private static final Logger log = LoggerFactory.getLogger(ExecutorClient.class);

    private static final Duration CANCEL_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     submitTimeout;

    public ExecutorClient(
            @Value("${boardpilot.executor.base-url}") String baseUrl,
            ObjectMapper objectMapper,
            ReactivationProperties props) {
        this.baseUrl       = baseUrl;
        this.json          = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.submitTimeout = props.getSubmitTimeout();
        this.http          = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    /**
     * Enqueue work for {@code runId}.
     *
     * @return the executor's job id
     * @throws ExecutorException on a non-2xx answer, a timeout or a response without a job id
     */
    public String submitJob(UUID runId, WorkDescriptor work) {
        String body = toJson(new SubmitJobRequest(runId, work));
        String respBody = post("/jobs", body, "submitJob for run " + runId, submitTimeout);
        try {
            SubmitJobResponse resp = json.readValue(respBody, SubmitJobResponse.class);
            if (resp.job_id() == null || resp.job_id().isBlank()) {
                throw new ExecutorException("submitJob for run " + runId + " returned no job_id");
            }
            log.info("Executor accepted job '{}' for run {}", resp.job_id(), runId);
            return resp.job_id();
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse submitJob response", e);
        }
    }

    /**
     * Ask the executor to cancel a job. Fire-and-forget from the caller's
     * point of view: the executor confirms through a FAILED job event, if at all.
     */
    public void cancelJob(String jobId) {
        log.info("Cancelling executor job '{}'", jobId);
        String path = "/jobs/" + URLEncoder.encode(jobId, StandardCharsets.UTF_8) + "/cancel";
        post(path, "{}", "cancelJob for " + jobId, CANCEL_TIMEOUT);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST with an explicit timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}

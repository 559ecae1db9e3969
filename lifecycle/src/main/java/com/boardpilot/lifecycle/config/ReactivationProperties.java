package com.boardpilot.lifecycle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reactivation policy knobs, bound from {@code boardpilot.reactivation.*}.
 */
@Component
@ConfigurationProperties(prefix = "boardpilot.reactivation")
public class ReactivationProperties {

    // Counted rejections after which a task stops being reactivable.
    private int maxAttempts = 5;

    private Duration baseBackoff = Duration.ofSeconds(30);
    private Duration maxBackoff  = Duration.ofMinutes(15);

    // A lock older than this is treated as abandoned.
    private Duration lockTtl = Duration.ofMinutes(30);

    // Upper bound on one submit_job call made while the task lock is held.
    private Duration submitTimeout = Duration.ofSeconds(10);

    public int      getMaxAttempts()   { return maxAttempts; }
    public Duration getBaseBackoff()   { return baseBackoff; }
    public Duration getMaxBackoff()    { return maxBackoff; }
    public Duration getLockTtl()       { return lockTtl; }
    public Duration getSubmitTimeout() { return submitTimeout; }

    public void setMaxAttempts(int maxAttempts)          { this.maxAttempts = maxAttempts; }
    public void setBaseBackoff(Duration baseBackoff)     { this.baseBackoff = baseBackoff; }
    public void setMaxBackoff(Duration maxBackoff)       { this.maxBackoff = maxBackoff; }
    public void setLockTtl(Duration lockTtl)             { this.lockTtl = lockTtl; }
    public void setSubmitTimeout(Duration submitTimeout) { this.submitTimeout = submitTimeout; }
}

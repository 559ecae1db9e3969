package com.boardpilot.lifecycle.service;

import java.time.Duration;

/**
 * Result of {@link CooldownPolicy#check}.
 *
 * @param outcome   what the policy decided
 * @param remaining time left in the cooldown window; zero unless THROTTLED
 */
public record CooldownCheck(Outcome outcome, Duration remaining) {

    public enum Outcome { ALLOWED, THROTTLED, MAX_ATTEMPTS_EXCEEDED }

    public static CooldownCheck allowed() {
        return new CooldownCheck(Outcome.ALLOWED, Duration.ZERO);
    }

    public static CooldownCheck throttled(Duration remaining) {
        return new CooldownCheck(Outcome.THROTTLED, remaining);
    }

    public static CooldownCheck maxAttemptsExceeded() {
        return new CooldownCheck(Outcome.MAX_ATTEMPTS_EXCEEDED, Duration.ZERO);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}

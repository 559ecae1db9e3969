package com.boardpilot.lifecycle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LifecycleConfig {

    /** Every component reads time from here so tests can move it. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

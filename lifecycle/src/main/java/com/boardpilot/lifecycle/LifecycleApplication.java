package com.boardpilot.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the BoardPilot task lifecycle controller.
 *
 * Decides whether board tasks may (re)enter execution, keeps their status
 * machine consistent and hands accepted work to the executor service.
 */
@SpringBootApplication
public class LifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(LifecycleApplication.class, args);
    }
}

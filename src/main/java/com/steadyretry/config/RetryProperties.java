package com.steadyretry.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Defaults for the {@link com.steadyretry.support.RetryTemplate} bean (exponential backoff, no jitter).
 */
@ConfigurationProperties(prefix = "steadyretry.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Max invocations, initial call included. Zero or negative means unbounded. Default 5. */
    private int maxAttempts = 5;

    /** Delay before the second attempt. Default 1s. */
    private Duration baseDelay = Duration.ofSeconds(1);

    /** Multiplier applied to the delay after each failed attempt; at least 1. Default 2. */
    private double backoffFactor = 2.0;

    /** Delay ceiling; zero disables it. Default 60s. */
    private Duration maxDelay = Duration.ofSeconds(60);

    /** Install a WARN-level logging notify hook on every session. Default true. */
    private boolean logFailedAttempts = true;
}

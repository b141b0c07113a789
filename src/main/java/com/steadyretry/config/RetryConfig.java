package com.steadyretry.config;

import com.steadyretry.common.Clock;
import com.steadyretry.common.WallClock;
import com.steadyretry.policy.AttemptBudget;
import com.steadyretry.policy.RetryPolicy;
import com.steadyretry.support.RetryTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the wall clock and a {@link RetryTemplate} from {@code steadyretry.retry.*}. Invalid settings fail context
 * startup with the same {@link com.steadyretry.error.InvalidRetryConfigurationException} a session would raise.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(RetryProperties.class)
public class RetryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock retryClock() {
        return WallClock.INSTANCE;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryTemplate retryTemplate(RetryProperties properties, Clock retryClock) {
        AttemptBudget attempts = properties.getMaxAttempts() > 0
                ? AttemptBudget.of(properties.getMaxAttempts())
                : AttemptBudget.unbounded();
        RetryTemplate template = new RetryTemplate(attempts, properties.getBaseDelay(), properties.getBackoffFactor(),
                properties.getMaxDelay(), retryClock, properties.isLogFailedAttempts());
        RetryPolicy resolved = template.newCallArgs("startup check").setOperation(() -> { }).validate();
        log.info("Retry template: attempts={}, baseDelay={}, backoffFactor={}, maxDelay={}",
                resolved.attempts(), resolved.delay(), resolved.backoffFactor(),
                resolved.hasMaxDelay() ? resolved.maxDelay() : "none");
        return template;
    }
}

package com.openforge.cortex.config;

import com.openforge.cortex.llm.AcceleratorFaultClassifier;
import com.openforge.cortex.llm.LlmProperties;
import com.openforge.cortex.llm.RetryState;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance, "completionGateway": accelerator faults only, up to
 * {@link RetryState#MAX_RETRIES} retries. Everything else fails the call at once.
 */
@Configuration
public class Resilience4jConfig {

    public static final String COMPLETION_GATEWAY = "completionGateway";

    @Bean
    public RetryRegistry retryRegistry(LlmProperties properties) {
        RetryRegistry registry = RetryRegistry.of(
                gatewayRetryConfig(Duration.ofMillis(Math.max(1, properties.retryWaitMillis()))));
        registry.retry(COMPLETION_GATEWAY);
        return registry;
    }

    @Bean
    public Retry completionGatewayRetry(RetryRegistry registry) {
        return registry.retry(COMPLETION_GATEWAY);
    }

    /**
     * The async retry loop gives up on a computed delay below 1 ms, so the wait must be at least that.
     */
    public static RetryConfig gatewayRetryConfig(Duration waitBetweenAttempts) {
        return RetryConfig.custom()
                .maxAttempts(RetryState.MAX_ATTEMPTS)
                .waitDuration(waitBetweenAttempts)
                .retryOnException(AcceleratorFaultClassifier::isTransient)
                .build();
    }
}

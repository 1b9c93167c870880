package com.openforge.storeagent.config;

import com.openforge.storeagent.llm.LlmClient;
import com.openforge.storeagent.llm.LlmProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for the completion provider.
 *
 * Only {@link LlmClient.LlmTransientException} (network, timeout, 429, 5xx)
 * is retried or counted by the breaker; a rejected request fails straight
 * through so that a malformed conversation does not trip the circuit.
 */
@Configuration
public class Resilience4jConfig {

    private static final String COMPLETION = "completion";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(LlmClient.LlmTransientException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(COMPLETION);
        return registry;
    }

    @Bean
    public CircuitBreaker completionCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(COMPLETION);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(LlmProperties properties) {
        LlmProperties.RetrySettings settings = properties.retry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                // exponential back-off: wait, wait*m, wait*m^2 ...
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.waitDuration(), settings.backoffMultiplier()))
                .retryExceptions(LlmClient.LlmTransientException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(COMPLETION);
        return registry;
    }

    @Bean
    public Retry completionRetry(RetryRegistry registry) {
        return registry.retry(COMPLETION);
    }
}

package com.openforge.actionmind.config;

import com.openforge.actionmind.embedding.EmbeddingClient;
import com.openforge.actionmind.embedding.EmbeddingProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Programmatic Resilience4j wiring for the one network collaborator of the
 * engine, the embedding provider.
 *
 *   retry         one extra attempt on network-level failures only
 *   circuit       stops calling a provider that keeps failing, so every
 *                 decision cycle is not charged the full timeout
 *   time limiter  hard upper bound on one embed() call, retries included
 */
@Configuration
public class Resilience4jConfig {

    public static final String EMBEDDING = "embedding";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(EmbeddingClient.EmbeddingException.class, TimeoutException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(EMBEDDING);
        return registry;
    }

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(EMBEDDING);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(200))
                // HTTP errors and bad payloads are not worth repeating
                .retryOnException(e -> e instanceof EmbeddingClient.EmbeddingException ee && ee.isNetworkError())
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(EMBEDDING);
        return registry;
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry(EMBEDDING);
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(EmbeddingProperties props) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(props.callTimeoutMillis()))
                .cancelRunningFuture(true)
                .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(config);
        registry.timeLimiter(EMBEDDING);
        return registry;
    }

    @Bean
    public TimeLimiter embeddingTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(EMBEDDING);
    }
}

package com.openforge.actionmind.embedding;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * The engine-facing embedding provider. Fails closed.
 *
 * Call graph of one embed():
 *
 *   circuitBreaker
 *     └─ timeLimiter (call-timeout-millis)
 *           └─ embeddingExecutor thread
 *                 └─ retry (network errors only)
 *                       └─ EmbeddingClient.embed()
 *
 * Timeout, open circuit, or any client error → WARN + Optional.empty().
 * Nothing thrown here ever reaches a strategy.
 */
@Slf4j
@Component
public class ResilientEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingClient     client;
    private final EmbeddingProperties props;
    private final CircuitBreaker      circuitBreaker;
    private final Retry               retry;
    private final TimeLimiter         timeLimiter;
    private final ExecutorService     executor;

    public ResilientEmbeddingProvider(EmbeddingClient client,
                                      EmbeddingProperties props,
                                      CircuitBreaker embeddingCircuitBreaker,
                                      Retry embeddingRetry,
                                      TimeLimiter embeddingTimeLimiter,
                                      ExecutorService embeddingExecutor) {
        this.client         = client;
        this.props          = props;
        this.circuitBreaker = embeddingCircuitBreaker;
        this.retry          = embeddingRetry;
        this.timeLimiter    = embeddingTimeLimiter;
        this.executor       = embeddingExecutor;
        if (!props.usable()) {
            log.warn("[Embed] Embedding provider not configured, few-shot matching disabled");
        }
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (!props.usable() || text == null || text.isBlank()) {
            return Optional.empty();
        }

        Supplier<float[]> withRetry = Retry.decorateSupplier(retry, () -> client.embed(text));
        Callable<float[]> limited = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(withRetry, executor));
        Callable<float[]> guarded = CircuitBreaker.decorateCallable(circuitBreaker, limited);

        try {
            return Optional.ofNullable(guarded.call());
        } catch (CallNotPermittedException e) {
            log.debug("[Embed] Circuit open, skipping embedding call");
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("[Embed] Embedding call exceeded {} ms", props.callTimeoutMillis());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[Embed] Embedding unavailable ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }
}

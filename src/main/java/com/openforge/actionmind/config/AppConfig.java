package com.openforge.actionmind.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.actionmind.embedding.EmbeddingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

/**
 * Core infrastructure beans:
 *  - Clock                → every "now" in the engine goes through it, so tests can pin time
 *  - Embedding executor   → runs embedding HTTP calls so the time limiter can abandon them
 *  - Java HttpClient      → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → snake_case on the wire, Java time as ISO-8601, tolerant reads
 *  - RandomGenerator      → exploration source of the reinforcement learner
 */
@Configuration
@EnableScheduling
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Small daemon pool for embedding calls. The decision cycle itself stays
     * on the caller's thread; only the blocking HTTP round-trip is handed off
     * so that a slow provider can be timed out.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService embeddingExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "embedding-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Single, shared HttpClient instance.
     * Connect timeout follows the embedding timeout; per-request read
     * timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(EmbeddingProperties embeddingProperties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(embeddingProperties.timeoutSeconds()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper, used both for the REST API and for the JSON columns
     * (context snapshots, action parameters):
     *  - snake_case property names
     *  - ISO-8601 dates, NOT timestamps
     *  - unknown properties silently ignored (older rows stay readable)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public RandomGenerator explorationRandom() {
        return RandomGenerator.getDefault();
    }
}

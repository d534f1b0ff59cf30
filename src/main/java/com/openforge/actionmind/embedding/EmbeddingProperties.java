package com.openforge.actionmind.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * actionmind:
 *   embedding:
 *     enabled: true
 *     base-url: http://localhost:11434/v1
 *     api-key: ${EMBEDDING_API_KEY:ollama}
 *     model: all-minilm
 *     dimensions: 384
 *     timeout-seconds: 5
 *     call-timeout-millis: 3000
 *
 * timeout-seconds bounds a single HTTP request; call-timeout-millis bounds
 * the whole embed() call seen by the decision cycle, retries included.
 */
@ConfigurationProperties(prefix = "actionmind.embedding")
public record EmbeddingProperties(
        @DefaultValue("true")        boolean enabled,
        String baseUrl,
        String apiKey,
        @DefaultValue("all-minilm")  String model,
        @DefaultValue("384")         int dimensions,
        @DefaultValue("5")           int timeoutSeconds,
        @DefaultValue("3000")        long callTimeoutMillis
) {

    /** True when embeddings are switched on and an endpoint is configured. */
    public boolean usable() {
        return enabled && baseUrl != null && !baseUrl.isBlank();
    }
}

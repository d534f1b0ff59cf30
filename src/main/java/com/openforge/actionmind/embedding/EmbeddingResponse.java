package com.openforge.actionmind.embedding;

import java.util.List;

/**
 * Response from POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "object": "list",
 *   "data": [
 *     { "object": "embedding", "index": 0, "embedding": [0.1, -0.2, ...] }
 *   ],
 *   "model": "all-minilm",
 *   "usage": { "prompt_tokens": 8, "total_tokens": 8 }
 * }
 */
public record EmbeddingResponse(
        String object,
        List<EmbeddingData> data,
        String model,
        Usage usage
) {

    /** Extract the embedding vector from the first (and typically only) result. */
    public float[] firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new IllegalStateException("Embedding response contained no data");
        }
        List<Float> values = data.get(0).embedding();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        return vector;
    }

    public record EmbeddingData(
            String object,
            int index,
            List<Float> embedding
    ) {}

    public record Usage(
            int promptTokens,
            int totalTokens
    ) {}
}

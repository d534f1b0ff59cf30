package com.openforge.actionmind.learning;

import com.openforge.actionmind.domain.Exemplar;
import com.openforge.actionmind.embedding.EmbeddingProvider;
import com.openforge.actionmind.history.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Semantic nearest-exemplar matching.
 *
 * Each successful (text, action) pair becomes an exemplar with a dense
 * embedding. A new request is embedded and compared against the stored
 * exemplars by cosine similarity. Exemplars that have succeeded often get up
 * to a 20% ranking boost, but the similarity gate always applies to the raw
 * cosine score, so popularity can reorder matches without letting a weak
 * match through.
 *
 * When the embedding provider is unavailable this matcher has no opinion and
 * stores nothing.
 */
@Slf4j
@Service
public class FewShotMatcher {

    private static final double MAX_BOOST = 0.2;

    private final EventStore        store;
    private final EmbeddingProvider embeddings;
    private final double            threshold;

    public FewShotMatcher(EventStore store, EmbeddingProvider embeddings, LearningProperties properties) {
        this.store      = store;
        this.embeddings = embeddings;
        this.threshold  = properties.fewShot().similarityThreshold();
    }

    /**
     * Remember that {@code action} worked for {@code text}. A repeat of an
     * existing (situation, action) pair only bumps its success count.
     *
     * @return true when an exemplar was created or bumped
     */
    public boolean storeExample(String text, String action, @Nullable String situation) {
        Optional<float[]> vector = embed(text);
        if (vector.isEmpty()) {
            log.debug("[FewShot] Embeddings unavailable, not storing exemplar for {}", action);
            return false;
        }

        Optional<Exemplar> existing = store.findExemplar(situation, action);
        if (existing.isPresent()) {
            return store.incrementExemplar(existing.get().getId());
        }
        boolean stored = store.saveExemplar(text, vector.get(), action, situation).isPresent();
        if (stored) log.info("[FewShot] New exemplar: {} → {}", situation, action);
        return stored;
    }

    /**
     * Best-matching exemplar for {@code text}, restricted to {@code situation}
     * when one is given.
     *
     * @return empty when embeddings are unavailable, nothing is stored, or the
     *         best match's raw similarity is below the threshold
     */
    public Optional<Prediction> predict(String text, @Nullable String situation) {
        if (text == null || text.isBlank()) return Optional.empty();

        Optional<float[]> query = embed(text);
        if (query.isEmpty()) return Optional.empty();

        List<Exemplar> candidates = store.findExemplars(situation);
        if (candidates.isEmpty()) return Optional.empty();

        Exemplar best      = null;
        double   bestRank  = Double.NEGATIVE_INFINITY;
        double   bestRaw   = 0.0;
        for (Exemplar candidate : candidates) {
            double raw  = cosine(query.get(), candidate.getEmbedding());
            double rank = raw * (1.0 + Math.min(candidate.getSuccessCount() / 10.0, MAX_BOOST));
            if (rank > bestRank) {
                best     = candidate;
                bestRank = rank;
                bestRaw  = raw;
            }
        }

        if (best == null || bestRaw < threshold) {
            log.debug("[FewShot] No exemplar above {} (best raw {})", threshold, bestRaw);
            return Optional.empty();
        }
        return Optional.of(Prediction.of(best.getAction(), bestRaw, PredictionSource.FEW_SHOT,
                String.format("Semantic match (similarity: %.0f%%)", bestRaw * 100)));
    }

    public EventStore.ExemplarStats stats() {
        return store.exemplarStats();
    }

    private Optional<float[]> embed(String text) {
        try {
            return embeddings.embed(text);
        } catch (RuntimeException e) {
            log.warn("[FewShot] Embedding provider failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Cosine similarity; 0 for mismatched dimensions or a zero vector. */
    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

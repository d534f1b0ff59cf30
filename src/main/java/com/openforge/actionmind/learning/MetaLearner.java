package com.openforge.actionmind.learning;

import com.openforge.actionmind.history.ActionSuccessRate;
import com.openforge.actionmind.history.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bootstraps a rarely seen situation from similar, well-known ones.
 *
 * Situation labels are compared by Jaccard overlap of their underscore
 * tokens ("deep_work_morning" vs "deep_work_evening" → 2/4). Actions that
 * reliably worked in the most similar known situation are transferred with
 * a discounted confidence, and every transfer is logged for audit.
 */
@Slf4j
@Service
public class MetaLearner {

    private static final double MIN_SOURCE_SUCCESS_RATE = 0.7;
    private static final long   MIN_SOURCE_FREQUENCY    = 2;
    private static final int    MAX_TRANSFERS           = 3;
    private static final double MAX_CONFIDENCE          = 0.9;

    private final EventStore store;
    private final double     threshold;
    private final long       minOccurrences;

    public MetaLearner(EventStore store, LearningProperties properties) {
        this.store          = store;
        this.threshold      = properties.meta().similarityThreshold();
        this.minOccurrences = properties.meta().minOccurrences();
    }

    public record SimilarSituation(String situation, double similarity) {}

    /**
     * Known situations (at least {@code min-occurrences} successes) whose
     * token overlap with {@code target} reaches the threshold, best first.
     */
    public List<SimilarSituation> findSimilarSituations(String target) {
        Set<String> targetTokens = tokens(target);
        List<SimilarSituation> similar = new ArrayList<>();

        for (Map.Entry<String, Long> known : store.situationFrequencies(target, minOccurrences).entrySet()) {
            double similarity = jaccard(targetTokens, tokens(known.getKey()));
            if (similarity > 0 && similarity >= threshold) {
                similar.add(new SimilarSituation(known.getKey(), similarity));
            }
        }
        similar.sort(Comparator.comparingDouble(SimilarSituation::similarity).reversed());
        return similar;
    }

    /**
     * Up to three reliable actions of {@code source}, re-labelled for
     * {@code target}. Confidence is min(rate · 0.8 + min(freq / 10, 0.15), 0.9).
     */
    public List<Prediction> transfer(String source, String target) {
        List<Prediction> transferred = new ArrayList<>();
        for (ActionSuccessRate rate : store.actionSuccessRates(source)) {
            if (transferred.size() == MAX_TRANSFERS) break;
            if (rate.successRate() <= MIN_SOURCE_SUCCESS_RATE || rate.frequency() < MIN_SOURCE_FREQUENCY) continue;

            double confidence = Math.min(
                    rate.successRate() * 0.8 + Math.min(rate.frequency() / 10.0, 0.15),
                    MAX_CONFIDENCE);
            transferred.add(Prediction.of(rate.action(), confidence, PredictionSource.META_LEARNING,
                    "Transferred from similar situation: " + source));
            store.logTransfer(source, target, rate.action(), confidence);
        }
        if (!transferred.isEmpty()) {
            log.info("[Meta] Transferred {} action(s) {} → {}", transferred.size(), source, target);
        }
        return transferred;
    }

    /** Best transferred action for a new situation, annotated with the source similarity. */
    public Optional<Prediction> bootstrap(String situation) {
        List<SimilarSituation> similar = findSimilarSituations(situation);
        if (similar.isEmpty()) return Optional.empty();

        SimilarSituation closest = similar.get(0);
        return transfer(closest.situation(), situation).stream()
                .findFirst()
                .map(p -> p.withSimilarity(closest.similarity()));
    }

    public EventStore.TransferStats stats() {
        return store.transferStats();
    }

    // ── Token overlap ────────────────────────────────────────────────────────

    static Set<String> tokens(String situation) {
        if (situation == null || situation.isBlank()) return Set.of();
        Set<String> tokens = new HashSet<>(Arrays.asList(situation.toLowerCase(Locale.ROOT).split("_")));
        tokens.remove("");
        return tokens;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / union.size();
    }
}

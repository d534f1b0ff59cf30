package com.openforge.actionmind.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.ActionRecord;
import com.openforge.actionmind.domain.Exemplar;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.domain.PatternTransfer;
import com.openforge.actionmind.domain.QValue;
import com.openforge.actionmind.domain.QValueId;
import com.openforge.actionmind.repository.ActionRecordRepository;
import com.openforge.actionmind.repository.ExemplarRepository;
import com.openforge.actionmind.repository.PatternTransferRepository;
import com.openforge.actionmind.repository.QValueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The engine's single persistence handle.
 *
 * Owns the four learning tables:
 *
 *   action_history     append-only log of executed actions (the event log)
 *   q_values           value table of the reinforcement learner
 *   embeddings         few-shot exemplars
 *   pattern_transfers  audit trail of meta-learner transfers
 *
 * Write rules:
 *   - every mutating call runs under one writer lock, so an embedding host
 *     that calls from several threads still sees serialized writes
 *   - every write is its own transaction and is committed before returning
 *   - a failed write is logged at WARN and reported through the return value
 *     (empty / false / 0); it never throws to the caller
 *
 * Reads are not locked and may throw Spring's DataAccessException; the
 * decision layer treats a failed read as "this strategy has no opinion".
 */
@Slf4j
@Service
public class EventStore {

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final ActionRecordRepository    records;
    private final QValueRepository          qValues;
    private final ExemplarRepository        exemplars;
    private final PatternTransferRepository transfers;
    private final ObjectMapper              objectMapper;
    private final Clock                     clock;
    private final TransactionTemplate       tx;

    private final ReentrantLock writeLock = new ReentrantLock();

    public EventStore(ActionRecordRepository records,
                      QValueRepository qValues,
                      ExemplarRepository exemplars,
                      PatternTransferRepository transfers,
                      ObjectMapper objectMapper,
                      Clock clock,
                      PlatformTransactionManager transactionManager) {
        this.records      = records;
        this.qValues      = qValues;
        this.exemplars    = exemplars;
        this.transfers    = transfers;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.tx           = new TransactionTemplate(transactionManager);
    }

    // ── Action history: write ────────────────────────────────────────────────

    /**
     * Append one executed action.
     *
     * @param context    snapshot the action ran under; its situation is recorded as well
     * @param action     action identifier
     * @param params     action parameters, may be null or empty
     * @param outcome    SUCCESS / FAILURE / CANCELED
     * @param durationMs execution time in milliseconds
     * @return id of the new row, or empty when the write failed
     */
    public Optional<Long> record(ContextSnapshot context,
                                 String action,
                                 @Nullable Map<String, ?> params,
                                 Outcome outcome,
                                 long durationMs) {
        try {
            ActionRecord row = ActionRecord.builder()
                    .timestamp(context.timestamp() != null ? context.timestamp() : LocalDateTime.now(clock))
                    .hour(context.hour())
                    .dayOfWeek(context.dayOfWeek())
                    .weekend(context.weekend())
                    .timeOfDay(context.timeOfDay() != null ? context.timeOfDay().label() : null)
                    .batteryPercent(context.batteryPercent())
                    .situation(context.situation())
                    .action(action)
                    .actionParams(params == null || params.isEmpty() ? null : objectMapper.writeValueAsString(params))
                    .outcome(outcome)
                    .executionTimeMs(durationMs)
                    .contextJson(objectMapper.writeValueAsString(context))
                    .build();

            Long id = write(() -> records.save(row).getId());
            log.debug("[EventStore] Recorded #{} {} → {} ({})", id, context.situation(), action, outcome);
            return Optional.ofNullable(id);
        } catch (Exception e) {
            log.warn("[EventStore] Failed to record action {} for situation {}: {}",
                    action, context.situation(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Delete action history older than {@code retentionDays}.
     *
     * @return number of deleted rows (0 when the delete failed)
     */
    public int prune(int retentionDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
        try {
            Integer deleted = write(() -> records.deleteOlderThan(cutoff));
            return deleted == null ? 0 : deleted;
        } catch (Exception e) {
            log.warn("[EventStore] Prune before {} failed: {}", cutoff, e.getMessage());
            return 0;
        }
    }

    // ── Action history: read ─────────────────────────────────────────────────

    /**
     * Successful records of {@code situation}, best context match first:
     * same time-of-day bucket, then within two hours, then same weekend flag,
     * then most recent.
     */
    public List<ActionRecord> querySimilar(ContextSnapshot context, String situation, int limit) {
        if (situation == null || limit <= 0) return List.of();
        String timeOfDay = context.timeOfDay() != null ? context.timeOfDay().label() : "";
        return records.findRankedByContext(situation, Outcome.SUCCESS, timeOfDay,
                context.hour(), context.weekend(), PageRequest.of(0, limit));
    }

    public ActionStats aggregate(String situation, String action) {
        long total     = records.countBySituationAndAction(situation, action);
        long successes = records.countBySituationAndActionAndOutcome(situation, action, Outcome.SUCCESS);
        Double avg     = successes > 0 ? records.averageDuration(situation, action, Outcome.SUCCESS) : null;
        return ActionStats.of(total, successes, avg);
    }

    public List<ActionRecord> recentActions(int limit) {
        return records.findAllByOrderByTimestampDesc(PageRequest.of(0, limit));
    }

    /** Successful occurrences of (situation, action) within the last {@code windowDays}. */
    public long patternFrequency(String situation, String action, int windowDays) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(windowDays);
        return records.countBySituationAndActionAndOutcomeAndTimestampGreaterThanEqual(
                situation, action, Outcome.SUCCESS, since);
    }

    /** Latest successful records of any situation, newest first. */
    public List<ActionRecord> latestSuccessful(int limit) {
        return records.findByOutcomeOrderByTimestampDesc(Outcome.SUCCESS, PageRequest.of(0, limit));
    }

    /** Latest successful uses of one action, newest first. */
    public List<ActionRecord> latestSuccessfulUses(String action, int limit) {
        return records.findByActionAndOutcomeOrderByTimestampDesc(action, Outcome.SUCCESS, PageRequest.of(0, limit));
    }

    /**
     * Situations other than {@code exclude} with at least {@code minSuccesses}
     * successful records, mapped to that success count.
     */
    public Map<String, Long> situationFrequencies(String exclude, long minSuccesses) {
        Map<String, Long> result = new LinkedHashMap<>();
        records.situationFrequencies(exclude == null ? "" : exclude, Outcome.SUCCESS, minSuccesses)
                .forEach(f -> result.put(f.getSituation(), f.getFrequency()));
        return result;
    }

    /**
     * Per-action attempt count and success rate within one situation, ordered
     * by success rate then frequency, both descending.
     */
    public List<ActionSuccessRate> actionSuccessRates(String situation) {
        Map<String, long[]> tally = new HashMap<>();   // action → {attempts, successes}
        for (ActionRecordRepository.ActionOutcomeCount c : records.outcomeCounts(situation)) {
            long[] t = tally.computeIfAbsent(c.getAction(), k -> new long[2]);
            t[0] += c.getCount();
            if (c.getOutcome() == Outcome.SUCCESS) t[1] += c.getCount();
        }
        List<ActionSuccessRate> rates = new ArrayList<>();
        tally.forEach((action, t) -> rates.add(new ActionSuccessRate(action, t[0], (double) t[1] / t[0])));
        rates.sort(Comparator.comparingDouble(ActionSuccessRate::successRate).reversed()
                .thenComparing(Comparator.comparingLong(ActionSuccessRate::frequency).reversed()));
        return rates;
    }

    public HistoryStats stats() {
        long total     = records.count();
        long successes = records.countByOutcome(Outcome.SUCCESS);
        Double avg     = records.averageDurationOverall();
        Map<String, Long> top = new LinkedHashMap<>();
        records.topSituations(PageRequest.of(0, 10))
                .forEach(f -> top.put(f.getSituation() == null ? "unknown" : f.getSituation(), f.getFrequency()));
        return new HistoryStats(
                total,
                successes,
                records.countDistinctSituations(),
                records.countDistinctActions(),
                total > 0 ? (double) successes / total : 0.0,
                avg == null ? 0.0 : avg,
                top);
    }

    // ── Row decoding ─────────────────────────────────────────────────────────

    /** The snapshot stored with a record; empty when the JSON is missing or unreadable. */
    public Optional<ContextSnapshot> contextOf(ActionRecord row) {
        if (row.getContextJson() == null) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(row.getContextJson(), ContextSnapshot.class));
        } catch (JsonProcessingException e) {
            log.debug("[EventStore] Unreadable context on record #{}: {}", row.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /** The parameters stored with a record; empty map when none or unreadable. */
    public Map<String, Object> paramsOf(ActionRecord row) {
        if (row.getActionParams() == null) return Map.of();
        try {
            Map<String, Object> params = objectMapper.readValue(row.getActionParams(), PARAMS_TYPE);
            return params == null ? Map.of() : params;
        } catch (JsonProcessingException e) {
            log.debug("[EventStore] Unreadable params on record #{}: {}", row.getId(), e.getMessage());
            return Map.of();
        }
    }

    // ── Value table ──────────────────────────────────────────────────────────

    public List<QValue> loadValueTable() {
        return qValues.findAll();
    }

    /**
     * Insert or overwrite one value-table cell, bumping its update counter.
     *
     * @return false when the write failed
     */
    public boolean upsertValue(String stateHash, String action, double value) {
        try {
            write(() -> {
                LocalDateTime now = LocalDateTime.now(clock);
                QValue cell = qValues.findById(new QValueId(stateHash, action))
                        .map(existing -> {
                            existing.setValue(value);
                            existing.setUpdateCount(existing.getUpdateCount() + 1);
                            existing.setLastUpdated(now);
                            return existing;
                        })
                        .orElseGet(() -> new QValue(stateHash, action, value, 1, now));
                return qValues.save(cell);
            });
            return true;
        } catch (Exception e) {
            log.warn("[EventStore] Failed to persist Q({}, {}): {}", stateHash, action, e.getMessage());
            return false;
        }
    }

    public Optional<QValue> findValue(String stateHash, String action) {
        return qValues.findById(new QValueId(stateHash, action));
    }

    /** Remove the whole value table. */
    public boolean clearValueTable() {
        try {
            write(() -> {
                qValues.deleteAllInBatch();
                return null;
            });
            return true;
        } catch (Exception e) {
            log.warn("[EventStore] Failed to clear value table: {}", e.getMessage());
            return false;
        }
    }

    public ValueTableStats valueTableStats() {
        Map<String, Double> top = new LinkedHashMap<>();
        qValues.topActions(PageRequest.of(0, 5)).forEach(v -> top.put(v.getAction(), v.getAverageValue()));
        return new ValueTableStats(qValues.count(), top);
    }

    // ── Exemplars ────────────────────────────────────────────────────────────

    /** All exemplars, or only those of {@code situation} when it is non-null. */
    public List<Exemplar> findExemplars(@Nullable String situation) {
        return situation == null ? exemplars.findAll() : exemplars.findBySituation(situation);
    }

    public Optional<Exemplar> findExemplar(@Nullable String situation, String action) {
        return exemplars.findFirstBySituationAndActionOrderByIdAsc(situation, action);
    }

    public Optional<Long> saveExemplar(String text, float[] embedding, String action, @Nullable String situation) {
        try {
            Exemplar row = Exemplar.builder()
                    .text(text)
                    .embedding(embedding)
                    .action(action)
                    .situation(situation)
                    .successCount(1)
                    .build();
            return Optional.ofNullable(write(() -> exemplars.save(row).getId()));
        } catch (Exception e) {
            log.warn("[EventStore] Failed to store exemplar {} → {}: {}", situation, action, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean incrementExemplar(Long id) {
        try {
            Integer updated = write(() -> exemplars.incrementSuccessCount(id));
            return updated != null && updated > 0;
        } catch (Exception e) {
            log.warn("[EventStore] Failed to bump exemplar #{}: {}", id, e.getMessage());
            return false;
        }
    }

    public ExemplarStats exemplarStats() {
        return new ExemplarStats(exemplars.count(), exemplars.countDistinctSituations(), exemplars.totalUses());
    }

    // ── Transfers ────────────────────────────────────────────────────────────

    public boolean logTransfer(String source, String target, String action, double confidence) {
        try {
            PatternTransfer row = PatternTransfer.builder()
                    .sourceSituation(source)
                    .targetSituation(target)
                    .patternType(PatternTransfer.ACTION_TRANSFER)
                    .action(action)
                    .confidence(confidence)
                    .build();
            write(() -> transfers.save(row));
            return true;
        } catch (Exception e) {
            log.warn("[EventStore] Failed to log transfer {} → {} ({}): {}", source, target, action, e.getMessage());
            return false;
        }
    }

    public List<PatternTransfer> transfersInto(String target) {
        return transfers.findByTargetSituationOrderByIdDesc(target);
    }

    public TransferStats transferStats() {
        Double avg = transfers.averageConfidence();
        return new TransferStats(transfers.count(), transfers.countDistinctTargets(), avg == null ? 0.0 : avg);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Run one write in its own committed transaction, serialized with every other write. */
    private <T> T write(Supplier<T> work) {
        writeLock.lock();
        try {
            return tx.execute(status -> work.get());
        } finally {
            writeLock.unlock();
        }
    }

    // ── Stats records ────────────────────────────────────────────────────────

    public record ValueTableStats(long totalValues, Map<String, Double> topActions) {}

    public record ExemplarStats(long totalExamples, long uniqueSituations, long totalUses) {}

    public record TransferStats(long totalTransfers, long uniqueTargets, double avgConfidence) {}
}

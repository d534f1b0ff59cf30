package com.openforge.actionmind.history;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops action history older than the retention window. */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionScheduler {

    private final EventStore        eventStore;
    private final HistoryProperties props;

    @Scheduled(cron = "${actionmind.history.prune-cron:0 30 3 * * *}")
    public void pruneExpiredHistory() {
        int deleted = eventStore.prune(props.retentionDays());
        log.info("[Retention] Pruned {} action records older than {} days", deleted, props.retentionDays());
    }
}

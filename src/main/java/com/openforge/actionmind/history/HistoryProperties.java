package com.openforge.actionmind.history;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * actionmind:
 *   history:
 *     retention-days: 90
 *     prune-cron: "0 30 3 * * *"
 */
@ConfigurationProperties(prefix = "actionmind.history")
public record HistoryProperties(
        @DefaultValue("90")            int    retentionDays,
        @DefaultValue("0 30 3 * * *")  String pruneCron
) {}

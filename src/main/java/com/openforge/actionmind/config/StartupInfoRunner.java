package com.openforge.actionmind.config;

import com.openforge.actionmind.embedding.EmbeddingProperties;
import com.openforge.actionmind.history.HistoryProperties;
import com.openforge.actionmind.learning.LearningProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - H2: opens a real JDBC connection and reads the engine version
 *   - Embedding: endpoint, model and whether the few-shot matcher can run at all
 *   - Learning: strategy gates, exploration rate and decision budget
 *   - History: retention window
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final EmbeddingProperties embeddingProperties;
    private final LearningProperties  learningProperties;
    private final HistoryProperties   historyProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        LearningProperties.Gates gates = learningProperties.gates();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              ActionMind  ·  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database (H2)                                           ║
                ║    {}
                ║    Retention      : {} days
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Few-shot       : {}
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Learning                                                ║
                ║    Gates          : rl>{}  few-shot>{}  meta>{}  knn>{}
                ║    Exploration    : ε={}  α={}  γ={}
                ║    Budget         : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),
                historyProperties.retentionDays(),

                embeddingProperties.usable() ? "✔ enabled" : "✘ disabled",
                embeddingProperties.model(), embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(), maskKey(embeddingProperties.apiKey()),

                gates.reinforcement(), gates.fewShot(), gates.meta(), gates.knn(),
                learningProperties.rl().epsilon(), learningProperties.rl().learningRate(),
                learningProperties.rl().discount(),
                learningProperties.decisionTimeout()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4; "(not set)" when blank. */
    private static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}

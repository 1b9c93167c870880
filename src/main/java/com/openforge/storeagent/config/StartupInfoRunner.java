package com.openforge.storeagent.config;

import com.openforge.storeagent.action.ActionQueueProperties;
import com.openforge.storeagent.approval.slack.SlackProperties;
import com.openforge.storeagent.embedding.EmbeddingProperties;
import com.openforge.storeagent.embedding.MilvusProperties;
import com.openforge.storeagent.llm.LlmProperties;
import com.openforge.storeagent.routing.RouterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a startup summary once the context is ready: database, vector
 * backend, completion and embedding providers (keys masked), routing
 * thresholds and the approval channel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource            dataSource;
    private final LlmProperties         llmProperties;
    private final EmbeddingProperties   embeddingProperties;
    private final MilvusProperties      milvusProperties;
    private final RouterProperties      routerProperties;
    private final ActionQueueProperties actionProperties;
    private final SlackProperties       slackProperties;
    private final Environment           env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Store Agent  —  Startup Summary             ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector search                                           ║
                ║    Milvus         : {}  {}:{}  collection={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Providers                                               ║
                ║    Completion     : {}  [{}]  key={}
                ║    Embedding      : {}  dim={}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Routing & approvals                                     ║
                ║    Threshold      : τ={}  δ={}  top-k={}  learning={}
                ║    Action TTL     : {}  sweep every {}
                ║    Channel        : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                checkDatabase(),

                milvusProperties.enabled() ? "✔ enabled" : "✘ disabled (in-process scan)",
                milvusProperties.host(), milvusProperties.port(), milvusProperties.collectionName(),

                llmProperties.provider().name(),
                llmProperties.provider().model(),
                maskKey(llmProperties.provider().apiKey()),
                embeddingProperties.model(),
                embeddingProperties.dimensions(),
                maskKey(embeddingProperties.apiKey()),

                routerProperties.confidenceThreshold(),
                routerProperties.margin(),
                routerProperties.topK(),
                routerProperties.learningEnabled(),
                actionProperties.ttl(),
                actionProperties.sweepInterval(),
                slackProperties.enabled() ? "slack #" + slackProperties.channel() : "log only"
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductName() + " " + conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4; "(not set)" for blanks and placeholders. */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}

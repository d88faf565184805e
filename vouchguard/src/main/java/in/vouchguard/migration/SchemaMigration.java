package in.vouchguard.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Creates the monitor tables on startup when they are missing.
 *
 * Tables: relationships, activities, alerts, defenses, cycle_logs, app_config.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Starting schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "relationships", """
                CREATE TABLE relationships (
                    id VARCHAR(100) PRIMARY KEY,
                    user_key VARCHAR(200) NOT NULL,
                    name VARCHAR(200),
                    address VARCHAR(100),
                    avatar_url TEXT,
                    active BOOLEAN NOT NULL DEFAULT TRUE,
                    score INT,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            createIfMissing(conn, "activities", """
                CREATE TABLE activities (
                    id VARCHAR(200) PRIMARY KEY,
                    relation_id VARCHAR(100) NOT NULL REFERENCES relationships(id),
                    activity_id VARCHAR(150) NOT NULL UNIQUE,
                    type VARCHAR(20) NOT NULL,
                    author_key VARCHAR(200),
                    author_name VARCHAR(200),
                    author_address VARCHAR(100),
                    score INT NOT NULL DEFAULT 0,
                    comment TEXT,
                    negative BOOLEAN NOT NULL DEFAULT FALSE,
                    alerted BOOLEAN NOT NULL DEFAULT FALSE,
                    created_at TIMESTAMPTZ NOT NULL
                )
                """,
                "CREATE INDEX idx_activities_relation ON activities (relation_id, created_at DESC)");

            createIfMissing(conn, "alerts", """
                CREATE TABLE alerts (
                    id VARCHAR(250) PRIMARY KEY,
                    review_id VARCHAR(200) NOT NULL,
                    relation_id VARCHAR(100) NOT NULL,
                    type VARCHAR(30) NOT NULL,
                    channel VARCHAR(20) NOT NULL,
                    status VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                    message_id VARCHAR(200),
                    sent_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    responded_at TIMESTAMPTZ,
                    UNIQUE (review_id, channel)
                )
                """,
                "CREATE INDEX idx_alerts_status ON alerts (status, sent_at)");

            createIfMissing(conn, "defenses", """
                CREATE TABLE defenses (
                    id VARCHAR(100) PRIMARY KEY,
                    review_id VARCHAR(200) NOT NULL,
                    target_key VARCHAR(200) NOT NULL,
                    score INT NOT NULL,
                    comment TEXT NOT NULL,
                    status VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                    network_review_id VARCHAR(100),
                    tx_hash VARCHAR(100),
                    error TEXT,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    posted_at TIMESTAMPTZ
                )
                """,
                """
                CREATE UNIQUE INDEX uq_defenses_active_review ON defenses (review_id)
                WHERE status IN ('PENDING', 'CONFIRMED')
                """);

            createIfMissing(conn, "cycle_logs", """
                CREATE TABLE cycle_logs (
                    id BIGSERIAL PRIMARY KEY,
                    relations_checked INT NOT NULL,
                    activities_found INT NOT NULL,
                    new_negative INT NOT NULL,
                    alerts_sent INT NOT NULL,
                    errors JSONB NOT NULL DEFAULT '[]'::jsonb,
                    duration_ms BIGINT NOT NULL,
                    run_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            createIfMissing(conn, "app_config", """
                CREATE TABLE app_config (
                    key VARCHAR(100) PRIMARY KEY,
                    value TEXT,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);

            log.info("[MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String... statements) throws Exception {
        if (tableExists(conn, table)) {
            log.info("[MIGRATION] {} table already exists", table);
            return;
        }
        log.info("[MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
        log.info("[MIGRATION] ✓ {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}

package in.cryptai.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

/**
 * Signal Schema Migration - Creates the tables signal generation owns, on startup.
 *
 * Creates two tables:
 * - generation_slots: per (date, hour) idempotency ledger
 * - trading_signals: every scored candidate of every run, winners flagged valid
 *
 * Statements are idempotent (IF NOT EXISTS) and stay within the SQL subset
 * PostgreSQL and H2 share.
 */
public final class SignalSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SignalSchemaMigration.class);

    private static final String CREATE_SLOTS = """
        CREATE TABLE IF NOT EXISTS generation_slots (
            slot_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            slot_date DATE NOT NULL,
            slot_hour INT NOT NULL,
            completed_at TIMESTAMP WITH TIME ZONE,
            created_at TIMESTAMP WITH TIME ZONE NOT NULL,
            CONSTRAINT uq_generation_slot UNIQUE (slot_date, slot_hour),
            CONSTRAINT ck_generation_slot_hour CHECK (slot_hour BETWEEN 0 AND 23)
        )
        """;

    // valid_day_key is candidate_id|produced_date on valid rows and NULL otherwise:
    // a plain unique column that emulates UNIQUE (candidate_id, produced_date) WHERE is_valid.
    private static final String CREATE_SIGNALS = """
        CREATE TABLE IF NOT EXISTS trading_signals (
            signal_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            candidate_id VARCHAR(64) NOT NULL,
            produced_date DATE,
            produced_hour INT,
            created_at TIMESTAMP WITH TIME ZONE NOT NULL,
            score DOUBLE PRECISION NOT NULL,
            is_valid BOOLEAN NOT NULL DEFAULT FALSE,
            valid_day_key VARCHAR(80),
            is_best_of_day BOOLEAN NOT NULL DEFAULT FALSE,
            best_of_day_date DATE,
            best_of_day_rank INT,
            CONSTRAINT uq_signal_valid_day_key UNIQUE (valid_day_key)
        )
        """;

    private static final String[] INDEXES = {
        "CREATE INDEX IF NOT EXISTS idx_signals_slot ON trading_signals (produced_date, produced_hour)",
        "CREATE INDEX IF NOT EXISTS idx_signals_best_of_day ON trading_signals (is_best_of_day, best_of_day_date)",
        "CREATE INDEX IF NOT EXISTS idx_signals_candidate_created ON trading_signals (candidate_id, created_at)",
        "CREATE INDEX IF NOT EXISTS idx_signals_valid_created ON trading_signals (is_valid, created_at)"
    };

    private final DataSource dataSource;

    public SignalSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables and indexes if they don't exist.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting signal schema migration");

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            stmt.execute(CREATE_SLOTS);
            log.info("[MIGRATION] ✓ generation_slots ready");

            stmt.execute(CREATE_SIGNALS);
            log.info("[MIGRATION] ✓ trading_signals ready");

            for (String index : INDEXES) {
                stmt.execute(index);
            }
            log.info("[MIGRATION] ✓ {} indexes ready", INDEXES.length);

            log.info("[MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Signal schema migration failed", e);
        }
    }
}

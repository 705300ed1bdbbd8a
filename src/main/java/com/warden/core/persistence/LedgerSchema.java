package com.warden.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the {@code events} and {@code updates} tables and their indexes.
 * Every statement is idempotent, so this runs on each startup.
 */
public final class LedgerSchema {

    private static final Logger log = LoggerFactory.getLogger(LedgerSchema.class);

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS events (
                id         INTEGER PRIMARY KEY AUTOINCREMENT,
                kind       TEXT NOT NULL,
                payload    TEXT,
                created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS updates (
                id         INTEGER PRIMARY KEY AUTOINCREMENT,
                name       TEXT NOT NULL,
                version    TEXT,
                state      TEXT CHECK (state IN ('pending', 'applied', 'failed', 'rolled_back')),
                meta       TEXT,
                created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
            )
            """,
            """
            CREATE UNIQUE INDEX IF NOT EXISTS ux_updates_pending_identity
                ON updates (name, IFNULL(version, '')) WHERE state = 'pending'
            """,
            """
            CREATE INDEX IF NOT EXISTS ix_updates_state ON updates (state)
            """,
            """
            CREATE INDEX IF NOT EXISTS ix_events_update_id
                ON events (json_extract(payload, '$.updateId'))
            """
    );

    private LedgerSchema() {}

    public static void createTables(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : STATEMENTS) {
                stmt.execute(sql);
            }
        }
        log.info("Ledger schema ensured (events, updates)");
    }
}

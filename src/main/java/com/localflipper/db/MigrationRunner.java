package com.localflipper.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Idempotent SQLite schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    private static final List<String> STATEMENTS = List.of(
            "CREATE TABLE IF NOT EXISTS saved_search (" +
                    "id INTEGER PRIMARY KEY AUTOINCREMENT," +
                    "term TEXT NOT NULL UNIQUE," +
                    "created_at TEXT NOT NULL" +
                    ")",
            "CREATE INDEX IF NOT EXISTS idx_saved_search_created ON saved_search(created_at, id)"
    );

    public void run(Database database) throws SQLException {
        String lastSql = "";
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            for (String sql : STATEMENTS) {
                lastSql = sql;
                st.execute(sql);
            }
        } catch (SQLException e) {
            String detail = "migration_failed: db=" + database.path()
                    + ", failed_sql=" + lastSql.replaceAll("\\s+", " ")
                    + ", cause=" + e.getMessage();
            LOG.error(detail);
            throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
        }
    }
}

package com.localflipper.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection manager for the local SQLite file that holds saved searches.
 */
public final class Database {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final Path dbPath;
    private final SQLiteDataSource dataSource;
    private final boolean sqlLogEnabled;

    public Database(Path dbPath, boolean sqlLogEnabled) {
        if (dbPath == null || dbPath.toString().isBlank()) {
            throw new IllegalArgumentException("db.path must not be empty");
        }
        this.dbPath = dbPath.toAbsolutePath().normalize();
        this.sqlLogEnabled = sqlLogEnabled;

        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        this.dataSource = new SQLiteDataSource(config);
        this.dataSource.setUrl("jdbc:sqlite:" + this.dbPath);
    }

    public Connection connect() throws SQLException {
        try {
            Path parent = dbPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SQLException("DB connect failed: cannot create directory for " + dbPath + ", cause=" + e.getMessage(), e);
        }
        try {
            Connection raw = dataSource.getConnection();
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String details = "DB connect failed: path=" + dbPath
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public Path path() {
        return dbPath;
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase();
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open")) {
            return "missing_dir";
        }
        return "connection_error";
    }
}

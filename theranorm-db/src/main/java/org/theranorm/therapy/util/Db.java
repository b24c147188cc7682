package org.theranorm.therapy.util;

/*
 * This file is part of TheraNorm.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * TheraNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * TheraNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with TheraNorm.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.theranorm.therapy.conf.ConfigLoader;

/**
 * JDBC helper used by the concept index sink and the ChEMBL extract reader:
 * connection retries with exponential backoff, streaming reads, small
 * mapped queries and a transaction wrapper.
 *
 * <p>This class does <i>not</i> own the {@link Connection} lifecycle.</p>
 */
public final class Db {

    private static final int DEFAULT_FETCH_SIZE = 5_000;

    private Db() {}

    @FunctionalInterface
    public interface ParamSetter {
        void accept(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetConsumer {
        void accept(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface SqlWork {
        void run() throws SQLException;
    }

    /* ---------------------------- Connections ---------------------------- */

    /**
     * JDBC URL for a schema on the configured server. {@code DB_URL}, when set,
     * wins over host/port and is used verbatim for the index database.
     */
    public static String jdbcUrl(ConfigLoader cfg, String schema) {
        if (schema == null || schema.equals(cfg.getDbName())) {
            String override = cfg.getDbUrl();
            if (StringUtils.isNotBlank(override)) {
                return override;
            }
        }
        String db = (schema == null) ? cfg.getDbName() : schema;
        return String.format("jdbc:mysql://%s:%s/%s?useSSL=false", cfg.getDbHost(), cfg.getDbPort(), db);
    }

    /** Open a connection to the index database, or to another schema on the same server. */
    public static Connection open(ConfigLoader cfg, String schema) {
        return getConnection(jdbcUrl(cfg, schema), cfg.getDbUser(), cfg.getDbPass(), cfg.getDbDriver(),
                3, Duration.ofMillis(250));
    }

    /**
     * Get a JDBC connection with retry and exponential backoff (capped at 30s).
     * If {@code driverClass} is given it is loaded once; a missing class is
     * reported and the service loader is relied upon instead.
     */
    public static Connection getConnection(String jdbcUrl,
                                           String user,
                                           String pass,
                                           String driverClass,
                                           int maxRetries,
                                           Duration initialBackoff) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        Objects.requireNonNull(user, "user must not be null");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = Duration.ofMillis(200);
        }

        if (StringUtils.isNotBlank(driverClass)) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException e) {
                Logger.warn("JDBC driver {} not found on classpath; relying on service loader", driverClass);
            }
        }

        int attempt = 0;
        long sleepMs = initialBackoff.toMillis();
        while (true) {
            try {
                Properties props = new Properties();
                props.setProperty("user", user);
                props.setProperty("password", pass == null ? "" : pass);
                props.setProperty("useServerPrepStmts", "true");
                props.setProperty("useCursorFetch", "true");
                return DriverManager.getConnection(jdbcUrl, props);
            } catch (SQLException ex) {
                attempt++;
                if (attempt > maxRetries) {
                    throw new IllegalStateException("DB connection failed after " + maxRetries + " retries: " + ex, ex);
                }
                Logger.warn("DB connection attempt {} failed ({}); retrying in {} ms", attempt, ex.getMessage(), sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("DB connection retry interrupted", ie);
                }
                sleepMs = Math.min(sleepMs * 2, Duration.ofSeconds(30).toMillis());
            }
        }
    }

    /* ---------------------------- Queries ---------------------------- */

    /**
     * Stream a large read-only query with a forward-only cursor. The
     * connection's read-only flag is restored afterwards.
     */
    public static void streamQuery(Connection conn,
                                   String sql,
                                   ParamSetter params,
                                   ResultSetConsumer consumer) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");

        boolean previousReadOnly = conn.isReadOnly();
        conn.setReadOnly(true);
        try (PreparedStatement ps = conn.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            ps.setFetchSize(DEFAULT_FETCH_SIZE);
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                consumer.accept(rs);
            }
        } finally {
            restoreReadOnly(conn, previousReadOnly);
        }
    }

    /** Run a small query and collect all rows. */
    public static <T> List<T> runQuery(Connection conn,
                                       String sql,
                                       ParamSetter params,
                                       RowMapper<T> mapper) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        List<T> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
        }
        return out;
    }

    /** Execute DDL/DML and return the update count. */
    public static int execute(Connection conn, String sql, ParamSetter params) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            return ps.executeUpdate();
        }
    }

    /* ---------------------------- Transactions ---------------------------- */

    /**
     * Run {@code body} in one transaction; rolls back and rethrows on failure.
     * The previous auto-commit mode is restored.
     */
    public static void withTransaction(Connection conn, SqlWork body) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        boolean prevAuto = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            body.run();
            conn.commit();
        } catch (SQLException | RuntimeException ex) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                ex.addSuppressed(rollbackEx);
            }
            throw ex;
        } finally {
            conn.setAutoCommit(prevAuto);
        }
    }

    private static void restoreReadOnly(Connection conn, boolean readOnly) {
        try {
            conn.setReadOnly(readOnly);
        } catch (SQLFeatureNotSupportedException e) {
            Logger.debug("Driver does not support read-only toggling: {}", e.getMessage());
        } catch (SQLException e) {
            Logger.warn("Unable to restore read-only flag: {}", e.getMessage());
        }
    }
}

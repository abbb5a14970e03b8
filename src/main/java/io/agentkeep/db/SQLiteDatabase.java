package io.agentkeep.db;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * SQLite-backed {@link SqlDatabase} holding one JDBC connection.
 *
 * <p>All access goes through the same connection, so calls are serialized on this
 * instance. Transactions are flat: a nested {@link #inTransaction(Supplier)} joins the
 * outer one and only the outermost call commits or rolls back.</p>
 */
public class SQLiteDatabase implements SqlDatabase {

    private static final Logger log = LoggerFactory.getLogger(SQLiteDatabase.class);

    private final String dbPath;
    private Connection connection;
    private int transactionDepth;

    public SQLiteDatabase(String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public synchronized void init() {
        if (connection != null) {
            return;
        }
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            log.info("SQLite database opened at: {}", dbPath);
        } catch (IOException | SQLException e) {
            log.error("Failed to open SQLite database at {}", dbPath, e);
            throw new StoreException("Database initialization failed: " + dbPath, e);
        }
    }

    @Override
    public synchronized int execute(String sql, Object... params) {
        try (var stmt = prepare(sql, params)) {
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Statement failed: " + firstLine(sql), e);
        }
    }

    @Override
    public synchronized <T> Optional<T> fetchOne(String sql, RowMapper<T> mapper, Object... params) {
        try (var stmt = prepare(sql, params);
             var rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.ofNullable(mapper.map(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + firstLine(sql), e);
        }
    }

    @Override
    public synchronized <T> List<T> fetchMany(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = new ArrayList<>();
        try (var stmt = prepare(sql, params);
             var rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(mapper.map(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + firstLine(sql), e);
        }
        return rows;
    }

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        Connection conn = requireConnection();
        if (transactionDepth > 0) {
            transactionDepth++;
            try {
                return work.get();
            } finally {
                transactionDepth--;
            }
        }

        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreException("Failed to begin transaction", e);
        }
        transactionDepth = 1;
        try {
            T result = work.get();
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollbackQuietly(conn, e);
            throw new StoreException("Failed to commit transaction", e);
        } catch (RuntimeException | Error e) {
            rollbackQuietly(conn, e);
            throw e;
        } finally {
            transactionDepth = 0;
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("Failed to restore auto-commit", e);
            }
        }
    }

    @Override
    public synchronized void executeScript(String... statements) {
        try (var stmt = requireConnection().createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new StoreException("Script failed", e);
        }
    }

    public synchronized boolean healthCheck() {
        try (var stmt = requireConnection().createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException | StoreException e) {
            log.warn("SQLite health check failed: {}", e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("SQLite database closed: {}", dbPath);
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            } finally {
                connection = null;
            }
        }
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        PreparedStatement stmt = requireConnection().prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                bind(stmt, i + 1, params[i]);
            }
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
        return stmt;
    }

    private static void bind(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setObject(index, null);
        } else if (value instanceof Instant instant) {
            stmt.setString(index, Timestamps.format(instant));
        } else if (value instanceof Enum<?> e) {
            stmt.setString(index, e.name().toLowerCase());
        } else if (value instanceof Boolean b) {
            stmt.setInt(index, b ? 1 : 0);
        } else {
            stmt.setObject(index, value);
        }
    }

    private Connection requireConnection() {
        if (connection == null) {
            throw new StoreException("Database not initialized: " + dbPath, null);
        }
        return connection;
    }

    private static void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static String firstLine(String sql) {
        String trimmed = sql.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}

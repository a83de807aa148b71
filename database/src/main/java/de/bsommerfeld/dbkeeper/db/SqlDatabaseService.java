package de.bsommerfeld.dbkeeper.db;

import de.bsommerfeld.dbkeeper.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <h3>Connection strategy</h3>
 * One connection is opened lazily and kept for the lifetime of the service.
 * An in-memory database only exists as long as its connection, and SQLite
 * serializes writes at the file level anyway. Access is serialized with a
 * reentrant lock so a transaction owns the connection until it ends.
 *
 * <h3>Parameter binding</h3>
 * {@link Instant} values are bound in the fixed-width {@link Timestamps}
 * format and {@link Boolean} values as {@code 0}/{@code 1}, matching how the
 * system tables store them.
 *
 * @see SqlLoader
 */
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    private final String jdbcUrl;
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection;
    private int transactionDepth;

    public SqlDatabaseService(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public static SqlDatabaseService forFile(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DatabaseAccessException("Cannot create database directory for " + file, e);
        }
        return new SqlDatabaseService("jdbc:sqlite:" + file.toAbsolutePath());
    }

    public static SqlDatabaseService inMemory() {
        return new SqlDatabaseService("jdbc:sqlite::memory:");
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            LOG.info("[DB] Opening {}", jdbcUrl);
            connection = DriverManager.getConnection(jdbcUrl);
        }
        return connection;
    }

    /**
     * Applies the DDL from {@code schema.sql}. Splits on semicolons and
     * executes each statement individually. Every statement uses
     * {@code IF NOT EXISTS}, so re-running is harmless.
     */
    public void applySchema() {
        lock.lock();
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new DatabaseAccessException("schema.sql not found in classpath");
            }
            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            Connection conn = connection();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                    String statement = stripComments(sql);
                    if (statement.isEmpty())
                        continue;
                    stmt.execute(statement);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            LOG.info("[DB] Schema applied");
        } catch (SQLException | IOException e) {
            throw new DatabaseAccessException("Schema application failed", e);
        } finally {
            lock.unlock();
        }
    }

    private static String stripComments(String sql) {
        StringBuilder out = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--"))
                out.append(line).append('\n');
        }
        return out.toString().trim();
    }

    // =====================================================================
    // Statement Execution
    // =====================================================================

    @Override
    public QueryResult executeStatement(String sql, List<Object> params, int maxRows) {
        lock.lock();
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            bind(ps, params);
            if (maxRows > 0)
                ps.setMaxRows(maxRows);
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    return new QueryResult(readRows(rs), 0);
                }
            }
            return QueryResult.ofChanges(Math.max(ps.getUpdateCount(), 0));
        } catch (SQLException e) {
            throw new DatabaseAccessException("Statement failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int execute(String sql) {
        lock.lock();
        try (Statement stmt = connection().createStatement()) {
            if (stmt.execute(sql)) {
                // PRAGMA statements may answer with a row; drain it
                try (ResultSet rs = stmt.getResultSet()) {
                    while (rs.next()) {
                        LOG.debug("[DB] {} -> {}", sql, rs.getObject(1));
                    }
                }
                return 0;
            }
            return Math.max(stmt.getUpdateCount(), 0);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Statement failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> explainQueryPlan(String sql, List<Object> params) {
        List<String> details = new ArrayList<>();
        for (Row row : executeStatement("EXPLAIN QUERY PLAN " + sql, params, 0).rows()) {
            if (row.has("detail"))
                details.add(row.getString("detail"));
        }
        return details;
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @Override
    public <T, E extends Exception> T inTransaction(TransactionWork<T, E> work) throws E {
        lock.lock();
        try {
            if (transactionDepth > 0) {
                transactionDepth++;
                try {
                    return work.execute(this);
                } finally {
                    transactionDepth--;
                }
            }
            Connection conn = begin();
            transactionDepth = 1;
            boolean committed = false;
            try {
                T result = work.execute(this);
                conn.commit();
                committed = true;
                return result;
            } catch (SQLException e) {
                throw new DatabaseAccessException("Commit failed", e);
            } finally {
                transactionDepth = 0;
                finish(conn, committed);
            }
        } finally {
            lock.unlock();
        }
    }

    private Connection begin() {
        try {
            Connection conn = connection();
            conn.setAutoCommit(false);
            return conn;
        } catch (SQLException e) {
            throw new DatabaseAccessException("Cannot begin transaction", e);
        }
    }

    private void finish(Connection conn, boolean committed) {
        try {
            if (!committed) {
                conn.rollback();
                LOG.warn("[DB] Transaction rolled back");
            }
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Cannot end transaction", e);
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                LOG.info("[DB] Closed {}", jdbcUrl);
            }
        } catch (SQLException e) {
            throw new DatabaseAccessException("Failed to close connection", e);
        } finally {
            connection = null;
            lock.unlock();
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Instant instant) {
                ps.setString(i + 1, Timestamps.format(instant));
            } else if (value instanceof Boolean flag) {
                ps.setInt(i + 1, flag ? 1 : 0);
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }

    private static List<Row> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int c = 1; c <= columns; c++) {
                values.put(meta.getColumnLabel(c), rs.getObject(c));
            }
            rows.add(new Row(values));
        }
        return rows;
    }
}

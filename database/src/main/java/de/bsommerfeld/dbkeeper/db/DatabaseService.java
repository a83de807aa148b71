package de.bsommerfeld.dbkeeper.db;

import java.util.List;

/**
 * Minimal statement-level access to the managed SQLite database. Every other
 * component goes through this interface, which keeps tests free to substitute
 * a mock where a real file is not wanted.
 *
 * @see SqlDatabaseService
 */
public interface DatabaseService extends AutoCloseable {

    default PreparedQuery prepare(String sql) {
        return new PreparedQuery(this, sql, List.of());
    }

    /**
     * Executes one statement with positional parameters.
     *
     * @param maxRows upper bound on returned rows, {@code 0} for unlimited
     * @throws DatabaseAccessException if the statement fails
     */
    QueryResult executeStatement(String sql, List<Object> params, int maxRows);

    /** Executes a parameterless statement (DDL, PRAGMA) and returns the change count. */
    int execute(String sql);

    /**
     * Returns the {@code detail} column of {@code EXPLAIN QUERY PLAN} for the
     * statement, one entry per plan step.
     */
    List<String> explainQueryPlan(String sql, List<Object> params);

    /**
     * Runs the work in a single transaction. Commits when the work returns,
     * rolls back when it throws. Nested calls join the outer transaction.
     */
    <T, E extends Exception> T inTransaction(TransactionWork<T, E> work) throws E;

    @Override
    void close();
}

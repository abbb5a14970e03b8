package io.agentkeep.db;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Minimal persistence contract used by the checkpoint store and the memory tier cache.
 * Statements are parameterized with positional {@code ?} placeholders.
 */
public interface SqlDatabase {

    /**
     * Runs a write statement.
     *
     * @return number of affected rows
     */
    int execute(String sql, Object... params);

    /**
     * Fetches the first row of a query, if any.
     */
    <T> Optional<T> fetchOne(String sql, RowMapper<T> mapper, Object... params);

    /**
     * Fetches every row of a query.
     */
    <T> List<T> fetchMany(String sql, RowMapper<T> mapper, Object... params);

    /**
     * Runs the given work so that all of its writes commit or roll back together.
     * A call made while a transaction is already open joins it.
     */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Void variant of {@link #inTransaction(Supplier)}.
     */
    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs DDL or other parameterless statements.
     */
    void executeScript(String... statements);
}

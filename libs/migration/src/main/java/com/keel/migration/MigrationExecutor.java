package com.keel.migration;

import java.util.List;
import java.util.Map;

/**
 * The database as seen by migrations and by the version ledger.
 *
 * <p>Implementations run one statement at a time and report every failure by throwing; none of the
 * methods returns a sentinel on error. Parameters bind positionally to {@code ?} placeholders.
 */
public interface MigrationExecutor {

    /**
     * Executes a statement that returns no rows (DDL, insert, update, delete).
     *
     * @param statement SQL text
     * @param params positional parameters
     */
    void execute(String statement, Object... params);

    /**
     * Runs a query and returns every row as a column-name to value map, in result-set order.
     *
     * @param query SQL text
     * @param params positional parameters
     * @return the rows, never null
     */
    List<Map<String, Object>> fetch(String query, Object... params);

    /**
     * Runs a query returning a single row with a single column.
     *
     * @param query SQL text
     * @param type expected Java type of the value
     * @param params positional parameters
     * @return the scalar value
     */
    <T> T fetchValue(String query, Class<T> type, Object... params);
}

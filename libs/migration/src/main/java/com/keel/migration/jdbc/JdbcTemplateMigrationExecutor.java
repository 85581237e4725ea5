package com.keel.migration.jdbc;

import com.keel.migration.MigrationExecutor;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link MigrationExecutor} backed by Spring's {@link JdbcTemplate}.
 *
 * <p>Errors surface as Spring {@link org.springframework.dao.DataAccessException}s; a duplicate
 * ledger insert, for example, arrives as {@link org.springframework.dao.DuplicateKeyException}.
 * Each call runs in its own auto-committed statement unless the caller opened a transaction.
 */
public class JdbcTemplateMigrationExecutor implements MigrationExecutor {

    private final JdbcTemplate jdbcTemplate;

    public JdbcTemplateMigrationExecutor(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void execute(String statement, Object... params) {
        if (params == null || params.length == 0) {
            jdbcTemplate.execute(statement);
        } else {
            jdbcTemplate.update(statement, params);
        }
    }

    @Override
    public List<Map<String, Object>> fetch(String query, Object... params) {
        return jdbcTemplate.queryForList(query, params == null ? new Object[0] : params);
    }

    @Override
    public <T> T fetchValue(String query, Class<T> type, Object... params) {
        return jdbcTemplate.queryForObject(query, type, params == null ? new Object[0] : params);
    }
}

package com.keel.migration.ledger;

import com.keel.migration.MigrationExecutor;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VersionLedger} stored in a single SQL table reached through a {@link MigrationExecutor}.
 *
 * <pre>
 * schema_migrations(
 *   version    VARCHAR(255) PRIMARY KEY,
 *   applied_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
 * )
 * </pre>
 *
 * <p>Uniqueness of a version is enforced by the primary key, so a duplicate {@link #record} fails
 * with whatever the executor raises for a constraint violation.
 */
public class JdbcVersionLedger implements VersionLedger {

    /** Default ledger table name. */
    public static final String DEFAULT_TABLE = "schema_migrations";

    private static final Logger log = LoggerFactory.getLogger(JdbcVersionLedger.class);
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final MigrationExecutor executor;
    private final String table;

    public JdbcVersionLedger(MigrationExecutor executor) {
        this(executor, DEFAULT_TABLE);
    }

    /**
     * @param executor database executor
     * @param table ledger table name; must be a plain SQL identifier
     */
    public JdbcVersionLedger(MigrationExecutor executor, String table) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid ledger table name: " + table);
        }
        this.executor = executor;
        this.table = table;
    }

    @Override
    public void ensureTable() {
        executor.execute(
                "CREATE TABLE IF NOT EXISTS "
                        + table
                        + " (version VARCHAR(255) PRIMARY KEY,"
                        + " applied_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP)");
        log.debug("Migration ledger table {} ensured", table);
    }

    @Override
    public boolean tableExists() {
        Number count =
                executor.fetchValue(
                        "SELECT COUNT(*) FROM information_schema.tables"
                                + " WHERE table_schema = current_schema"
                                + " AND LOWER(table_name) = LOWER(?)",
                        Long.class,
                        table);
        return count != null && count.longValue() > 0;
    }

    @Override
    public List<AppliedMigration> listApplied() {
        List<Map<String, Object>> rows =
                executor.fetch("SELECT version, applied_at FROM " + table + " ORDER BY version");
        List<AppliedMigration> applied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            applied.add(
                    new AppliedMigration(
                            String.valueOf(column(row, "version")),
                            toInstant(column(row, "applied_at"))));
        }
        return applied;
    }

    @Override
    public boolean isApplied(String version) {
        Number count =
                executor.fetchValue(
                        "SELECT COUNT(*) FROM " + table + " WHERE version = ?",
                        Long.class,
                        version);
        return count != null && count.longValue() > 0;
    }

    @Override
    public void record(String version) {
        executor.execute("INSERT INTO " + table + " (version) VALUES (?)", version);
        log.info("Migration {} recorded", version);
    }

    @Override
    public void unrecord(String version) {
        executor.execute("DELETE FROM " + table + " WHERE version = ?", version);
        log.info("Migration {} record removed", version);
    }

    /** Returns the ledger table name. */
    public String table() {
        return table;
    }

    // Drivers differ in the case they report column labels in.
    private static Object column(Map<String, Object> row, String name) {
        if (row.containsKey(name)) {
            return row.get(name);
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw new IllegalStateException(
                "Unsupported applied_at value type: " + value.getClass().getName());
    }
}

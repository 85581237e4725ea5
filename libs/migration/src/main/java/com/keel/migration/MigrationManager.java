package com.keel.migration;

import com.keel.migration.ledger.AppliedMigration;
import com.keel.migration.ledger.VersionLedger;
import com.keel.migration.registry.MigrationRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Applies pending migrations and rolls back applied ones.
 *
 * <p>The manager ties together a {@link MigrationRegistry} (what exists), a {@link VersionLedger}
 * (what has run) and a {@link MigrationExecutor} (where it runs). Every step is synchronous and
 * strictly ordered by version; the first failure aborts the call and leaves the ledger exactly as
 * of the last successful step.
 *
 * <h2>Consistency</h2>
 *
 * <p>A migration and its ledger write are separate statements. If a forward operation fails after
 * part of its DDL ran, the version is not recorded and the schema may be ahead of the ledger; the
 * script has to be fixed and the run repeated.
 *
 * <h2>Concurrency</h2>
 *
 * <p>No lock is taken. Two processes applying migrations against the same database at once may
 * both run a version; the later ledger insert then fails on the primary key. Deployments are
 * expected to run migrations from a single place.
 */
public class MigrationManager {

    /** MDC key holding the migration currently running. */
    public static final String MDC_MIGRATION = "migration";

    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private final MigrationRegistry registry;
    private final VersionLedger ledger;
    private final MigrationExecutor executor;
    private final MigrationListener listener;

    public MigrationManager(
            MigrationRegistry registry, VersionLedger ledger, MigrationExecutor executor) {
        this(registry, ledger, executor, MigrationListener.NOOP);
    }

    public MigrationManager(
            MigrationRegistry registry,
            VersionLedger ledger,
            MigrationExecutor executor,
            MigrationListener listener) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.registry = registry;
        this.ledger = ledger;
        this.executor = executor;
        this.listener = listener != null ? listener : MigrationListener.NOOP;
        log.info("MigrationManager initialized");
    }

    /**
     * Applies every pending migration in ascending version order.
     *
     * @return names applied by this call, in the order they ran
     * @throws MigrationException on the first failure; later migrations are left unapplied
     */
    public List<String> applyAllMigrations() {
        ledger.ensureTable();

        List<String> appliedNow = new ArrayList<>();
        for (MigrationSource source : registry.discover()) {
            String name = registry.nameOf(source);
            if (ledger.isApplied(name)) {
                log.debug("Migration already applied: {}", name);
                continue;
            }
            runMigration(source, Direction.FORWARD);
            appliedNow.add(name);
            log.info("Applied migration: {}", name);
        }

        if (appliedNow.isEmpty()) {
            log.info("Database schema is up to date");
        } else {
            log.info("Applied {} migration(s)", appliedNow.size());
        }
        return appliedNow;
    }

    /**
     * Rolls back one applied migration.
     *
     * <p>Rolling back a version that is not applied, including on a database that has no ledger
     * table yet, only logs a warning and leaves the database untouched. To undo several versions,
     * call this once per version, newest first.
     *
     * @param version migration name, e.g. {@code 002_create_tasks_table}
     * @return true if the backward operation ran, false if the version was not applied
     * @throws MigrationNotFoundException if the version is applied but no source provides it
     * @throws MigrationException if the backward operation fails
     */
    public boolean rollbackMigration(String version) {
        if (!ledger.tableExists() || !ledger.isApplied(version)) {
            log.warn("Migration {} is not applied", version);
            return false;
        }

        MigrationSource source =
                registry.find(version).orElseThrow(() -> new MigrationNotFoundException(version));
        runMigration(source, Direction.BACKWARD);
        log.info("Rolled back migration: {}", version);
        return true;
    }

    /**
     * Loads one migration, runs it in the given direction and updates the ledger: record after a
     * forward run, unrecord after a backward run.
     *
     * @throws MigrationSourceNotFoundException if the source no longer exists
     * @throws MigrationLoadException if the source cannot be parsed
     * @throws InvalidMigrationFormatException if the source lacks the requested operation
     * @throws MigrationExecutionException if the operation or the ledger update fails
     */
    public void runMigration(MigrationSource source, Direction direction) {
        if (!source.exists()) {
            throw new MigrationSourceNotFoundException(source.location());
        }

        MigrationUnit unit = registry.load(source);
        String name = unit.name();
        MigrationOperation operation =
                unit.operation(direction)
                        .orElseThrow(() -> new InvalidMigrationFormatException(name, direction));

        long start = System.nanoTime();
        try {
            MDC.put(MDC_MIGRATION, name);
            listener.onMigrationStarted(name, direction);
            operation.apply(executor);
            if (direction == Direction.FORWARD) {
                ledger.record(name);
            } else {
                ledger.unrecord(name);
            }
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.error("Migration {} failed ({})", name, direction.keyword(), e);
            listener.onMigrationFailed(name, direction, elapsed, e);
            throw new MigrationExecutionException(name, direction, e);
        } finally {
            MDC.remove(MDC_MIGRATION);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        listener.onMigrationCompleted(name, direction, elapsed);
        log.info(
                "Migration {} executed successfully ({}) in {} ms",
                name,
                direction.keyword(),
                elapsed.toMillis());
    }

    /** Returns the ledger contents, ascending by version. Empty if the ledger table is absent. */
    public List<AppliedMigration> getAppliedMigrations() {
        return ledger.tableExists() ? ledger.listApplied() : List.of();
    }

    /** Returns every available migration source, ascending by version. */
    public List<MigrationSource> discoverMigrationFiles() {
        return registry.discover();
    }

    /** Returns the names of available migrations that are not applied, ascending. */
    public List<String> pendingMigrations() {
        return status().pending();
    }

    /**
     * Builds a status snapshot without writing to the database. A database with no ledger table
     * reports every migration as pending.
     */
    public MigrationStatus status() {
        List<String> available =
                registry.discover().stream().map(registry::nameOf).collect(Collectors.toList());
        List<AppliedMigration> applied = getAppliedMigrations();
        Set<String> appliedNames =
                applied.stream().map(AppliedMigration::version).collect(Collectors.toSet());
        List<String> pending =
                available.stream()
                        .filter(name -> !appliedNames.contains(name))
                        .collect(Collectors.toList());
        String current = applied.isEmpty() ? null : applied.get(applied.size() - 1).version();
        return new MigrationStatus(available, applied, pending, current);
    }

    public MigrationRegistry registry() {
        return registry;
    }
}

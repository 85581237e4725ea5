package com.keel.migration.testing;

import com.keel.migration.ledger.AppliedMigration;
import com.keel.migration.ledger.VersionLedger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A {@link VersionLedger} held in memory, for tests.
 *
 * <p>Mirrors the SQL ledger: versions are unique and listed in ascending order, and recording a
 * version twice fails. Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryVersionLedger implements VersionLedger {

    private final Map<String, Instant> applied = new TreeMap<>();
    private final Clock clock;
    private int ensureTableCalls;
    private boolean created;

    public InMemoryVersionLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryVersionLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void ensureTable() {
        ensureTableCalls++;
        created = true;
    }

    @Override
    public synchronized boolean tableExists() {
        return created;
    }

    @Override
    public synchronized List<AppliedMigration> listApplied() {
        return applied.entrySet().stream()
                .map(e -> new AppliedMigration(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean isApplied(String version) {
        return applied.containsKey(version);
    }

    /**
     * @throws IllegalStateException if the version is already recorded
     */
    @Override
    public synchronized void record(String version) {
        if (applied.containsKey(version)) {
            throw new IllegalStateException(
                    "duplicate key value violates unique constraint: " + version);
        }
        applied.put(version, clock.instant());
        created = true;
    }

    @Override
    public synchronized void unrecord(String version) {
        applied.remove(version);
    }

    /** Returns the applied version names, ascending. */
    public synchronized List<String> versions() {
        return List.copyOf(applied.keySet());
    }

    /** Returns how many times {@link #ensureTable()} was called. */
    public synchronized int ensureTableCalls() {
        return ensureTableCalls;
    }
}

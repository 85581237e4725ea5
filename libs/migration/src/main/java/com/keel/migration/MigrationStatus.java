package com.keel.migration;

import com.keel.migration.ledger.AppliedMigration;
import java.util.List;

/**
 * Snapshot of the migration state of a database.
 *
 * @param available names of every discovered migration, in version order
 * @param applied ledger records, in version order
 * @param pending available migrations not yet applied, in version order
 * @param currentVersion highest applied name, or null when nothing is applied
 */
public record MigrationStatus(
        List<String> available,
        List<AppliedMigration> applied,
        List<String> pending,
        String currentVersion) {

    public MigrationStatus {
        available = List.copyOf(available);
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
    }

    /** Whether every available migration has been applied. */
    public boolean upToDate() {
        return pending.isEmpty();
    }
}

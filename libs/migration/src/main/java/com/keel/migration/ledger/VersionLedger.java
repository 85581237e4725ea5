package com.keel.migration.ledger;

import java.util.List;

/**
 * Durable record of which migrations are applied.
 *
 * <p>Presence of a version means its forward operation completed without error. Rolling a version
 * back deletes its record; no history of undone applications is kept.
 */
public interface VersionLedger {

    /** Creates the ledger storage if it does not exist yet. Safe to call on every start. */
    void ensureTable();

    /** Whether the ledger storage exists. Issues no DDL. */
    boolean tableExists();

    /** Returns every applied version, ascending. */
    List<AppliedMigration> listApplied();

    /** Whether the version is recorded as applied. */
    boolean isApplied(String version);

    /**
     * Records a version as applied.
     *
     * <p>Recording a version twice fails with the storage's uniqueness error.
     */
    void record(String version);

    /** Removes the record of a version. Does nothing if the version is not recorded. */
    void unrecord(String version);
}

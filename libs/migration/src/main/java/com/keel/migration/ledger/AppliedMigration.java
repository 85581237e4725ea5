package com.keel.migration.ledger;

import java.time.Instant;

/**
 * One row of the version ledger.
 *
 * @param version the migration name, e.g. {@code 001_create_agent_memory}
 * @param appliedAt when the forward operation completed
 */
public record AppliedMigration(String version, Instant appliedAt) {}

package com.keel.migration;

/**
 * Wraps any failure raised while a migration operation or its ledger update runs.
 *
 * <p>The message carries the migration name, the direction and the message of the original cause.
 * Migrations applied earlier in the same batch stay applied.
 */
public class MigrationExecutionException extends MigrationException {

    private final String migrationName;
    private final Direction direction;

    public MigrationExecutionException(String migrationName, Direction direction, Throwable cause) {
        super(
                "Migration execution failed: "
                        + migrationName
                        + " ("
                        + direction.keyword()
                        + "): "
                        + cause.getMessage(),
                cause);
        this.migrationName = migrationName;
        this.direction = direction;
    }

    public String getMigrationName() {
        return migrationName;
    }

    public Direction getDirection() {
        return direction;
    }
}

package com.keel.migration;

/**
 * Thrown when a loaded migration lacks the operation for the requested direction, for example a
 * script without a {@code -- migrate:down} section being rolled back.
 */
public class InvalidMigrationFormatException extends MigrationException {

    private final String migrationName;
    private final Direction direction;

    public InvalidMigrationFormatException(String migrationName, Direction direction) {
        super(
                "Invalid migration format: "
                        + migrationName
                        + " is missing '"
                        + direction.keyword()
                        + "' operation");
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

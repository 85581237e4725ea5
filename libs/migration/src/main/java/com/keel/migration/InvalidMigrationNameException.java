package com.keel.migration;

/** Thrown when a migration name does not follow the {@code NNN_description} format. */
public class InvalidMigrationNameException extends MigrationException {

    public InvalidMigrationNameException(String message) {
        super(message);
    }
}

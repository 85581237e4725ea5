package com.keel.migration;

/** Thrown when a migration source cannot be parsed or resolved into a {@link MigrationUnit}. */
public class MigrationLoadException extends MigrationException {

    public MigrationLoadException(String message) {
        super(message);
    }

    public MigrationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.keel.migration;

/**
 * Base class for every failure raised by the migration engine.
 *
 * <p>Unchecked: a migration failure is fatal to the current apply or rollback call and is meant to
 * bubble up to the deployment tooling that started it.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.keel.migration;

/** Thrown when a migration source handed to the manager does not exist. */
public class MigrationSourceNotFoundException extends MigrationException {

    private final String location;

    public MigrationSourceNotFoundException(String location) {
        super("Migration file not found: " + location);
        this.location = location;
    }

    /** Returns the location that could not be found. */
    public String getLocation() {
        return location;
    }
}

package com.keel.migration;

/** Thrown by rollback when an applied version has no corresponding migration source. */
public class MigrationNotFoundException extends MigrationException {

    private final String version;

    public MigrationNotFoundException(String version) {
        super("Migration file not found for version: " + version);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}

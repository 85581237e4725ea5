package com.keel.migration.registry;

import com.keel.migration.JavaMigration;
import com.keel.migration.MigrationSource;

/**
 * A {@link JavaMigration} listed in the migration manifest.
 *
 * @param migration the migration instance
 */
public record ManifestEntry(JavaMigration migration) implements MigrationSource {

    public ManifestEntry {
        if (migration == null) {
            throw new IllegalArgumentException("migration must not be null");
        }
    }

    /** The migration name; manifest entries have no extension. */
    @Override
    public String fileName() {
        return migration.name();
    }

    @Override
    public String location() {
        return migration.getClass().getName();
    }

    @Override
    public boolean exists() {
        return true;
    }
}

package com.keel.migration.registry;

import com.keel.migration.MigrationSource;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A SQL migration script on disk.
 *
 * @param path location of the script
 */
public record ScriptFile(Path path) implements MigrationSource {

    public ScriptFile {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
    }

    @Override
    public String fileName() {
        return path.getFileName().toString();
    }

    @Override
    public String location() {
        return path.toString();
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(path);
    }
}

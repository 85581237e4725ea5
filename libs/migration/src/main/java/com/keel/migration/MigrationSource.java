package com.keel.migration;

/**
 * Where a migration comes from: a script file on disk or an entry of the migration manifest.
 *
 * <p>Sources are cheap handles; nothing is read until a registry loads them.
 */
public interface MigrationSource {

    /** File name including the extension, e.g. {@code 001_create_agent_memory.sql}. */
    String fileName();

    /** Human readable location used in messages (path or class name). */
    String location();

    /** Whether the source can still be loaded. */
    boolean exists();
}

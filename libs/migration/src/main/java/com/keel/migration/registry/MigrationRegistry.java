package com.keel.migration.registry;

import com.keel.migration.MigrationLoadException;
import com.keel.migration.MigrationNames;
import com.keel.migration.MigrationSource;
import com.keel.migration.MigrationUnit;
import java.util.List;
import java.util.Optional;

/**
 * Enumerates the migrations available to the manager.
 *
 * <p>Discovery is read-only: calling {@link #discover()} twice without changes to the underlying
 * source yields the same sequence.
 */
public interface MigrationRegistry {

    /** Returns every available migration source, ascending by version. */
    List<MigrationSource> discover();

    /**
     * Loads the operations of a source.
     *
     * @throws MigrationLoadException if the source cannot be parsed or resolved
     */
    MigrationUnit load(MigrationSource source);

    /** Whether this registry knows how to {@link #load} the given source. */
    boolean supports(MigrationSource source);

    /** Derives the migration name of a source by stripping directory and extension. */
    default String nameOf(MigrationSource source) {
        return MigrationNames.nameOf(source.fileName());
    }

    /** Finds a discovered source by migration name. */
    default Optional<MigrationSource> find(String name) {
        return discover().stream().filter(s -> nameOf(s).equals(name)).findFirst();
    }
}

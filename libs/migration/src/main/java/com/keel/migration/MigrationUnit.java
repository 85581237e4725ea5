package com.keel.migration;

import java.util.Optional;

/**
 * A loaded migration: its name and the operations for each direction.
 *
 * <p>An operation is null when the source does not provide it; asking the manager to run that
 * direction fails with {@link InvalidMigrationFormatException}.
 *
 * @param name {@code NNN_description}
 * @param forward applies the change, or null
 * @param backward undoes the change, or null
 */
public record MigrationUnit(String name, MigrationOperation forward, MigrationOperation backward) {

    public MigrationUnit {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    /** Returns the version ordinal of this unit. */
    public String version() {
        return MigrationNames.parseVersion(name);
    }

    /** Returns the description part of the name. */
    public String description() {
        return MigrationNames.parseDescription(name);
    }

    /** Returns the operation for the given direction, if the source provides one. */
    public Optional<MigrationOperation> operation(Direction direction) {
        return Optional.ofNullable(direction == Direction.FORWARD ? forward : backward);
    }
}

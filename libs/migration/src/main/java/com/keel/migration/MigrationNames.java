package com.keel.migration;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Naming rules for migrations.
 *
 * <p>A migration name is {@code NNN_description}: a three digit, zero padded ordinal followed by a
 * description made of letters and underscores. Because the ordinal has a fixed width, sorting names
 * lexicographically sorts them by version.
 */
public final class MigrationNames {

    /** Width of the version ordinal. */
    public static final int VERSION_WIDTH = 3;

    /** Highest ordinal that fits in {@link #VERSION_WIDTH} digits. */
    public static final int MAX_VERSION = 999;

    private static final Pattern NAME = Pattern.compile("^\\d{3}_[a-zA-Z_]+$");
    private static final Pattern DESCRIPTION = Pattern.compile("^[a-zA-Z_]+$");
    private static final Pattern VERSION = Pattern.compile("^\\d{3}$");

    private MigrationNames() {}

    /**
     * Checks a migration name against the {@code NNN_description} format.
     *
     * @param name candidate name, may be null
     * @return true if the name is well formed
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        return NAME.matcher(name).matches();
    }

    /**
     * Extracts the version ordinal from a migration name.
     *
     * @param name migration name such as {@code 042_add_feature}
     * @return the ordinal, e.g. {@code "042"}
     * @throws InvalidMigrationNameException if the name has no three digit prefix or no description
     */
    public static String parseVersion(String name) {
        String[] parts = split(name);
        return parts[0];
    }

    /**
     * Extracts the description from a migration name.
     *
     * @throws InvalidMigrationNameException if the name is malformed
     */
    public static String parseDescription(String name) {
        String[] parts = split(name);
        return parts[1];
    }

    /**
     * Derives the logical migration name from a file name or path by dropping any directory and
     * the extension.
     *
     * @param fileName e.g. {@code scripts/001_create_agent_memory.sql}
     * @return e.g. {@code 001_create_agent_memory}
     */
    public static String nameOf(String fileName) {
        String base = fileName;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    /**
     * Builds the file name for a new migration, numbered one above the highest existing version.
     *
     * @param description letters and underscores only
     * @param existingNames names (or file names) of the migrations already present
     * @param extension file extension without the dot
     * @return e.g. {@code 003_add_index.sql}
     * @throws InvalidMigrationNameException if the description is invalid or the ordinals are
     *     exhausted
     */
    public static String nextFileName(
            String description, Collection<String> existingNames, String extension) {
        if (description == null || !DESCRIPTION.matcher(description).matches()) {
            throw new InvalidMigrationNameException(
                    "Invalid migration description: '" + description + "' (letters and _ only)");
        }
        int highest = 0;
        for (String existing : existingNames) {
            String name = nameOf(existing);
            if (isValidName(name)) {
                highest = Math.max(highest, Integer.parseInt(parseVersion(name)));
            }
        }
        int next = highest + 1;
        if (next > MAX_VERSION) {
            throw new InvalidMigrationNameException(
                    "No migration version left after " + formatVersion(highest));
        }
        return formatVersion(next) + "_" + description + "." + extension;
    }

    /** Zero pads an ordinal to {@link #VERSION_WIDTH} digits. */
    public static String formatVersion(int ordinal) {
        return String.format("%0" + VERSION_WIDTH + "d", ordinal);
    }

    private static String[] split(String name) {
        if (name == null) {
            throw new InvalidMigrationNameException("Invalid migration name format: null");
        }
        String[] parts = name.split("_", 2);
        if (parts.length < 2 || !VERSION.matcher(parts[0]).matches()) {
            throw new InvalidMigrationNameException("Invalid migration name format: " + name);
        }
        return parts;
    }
}

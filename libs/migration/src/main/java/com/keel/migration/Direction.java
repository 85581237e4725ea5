package com.keel.migration;

import java.util.Locale;

/** The two halves of a migration. */
public enum Direction {

    /** Applies the schema change. */
    FORWARD("up"),

    /** Undoes the schema change. */
    BACKWARD("down");

    private final String keyword;

    Direction(String keyword) {
        this.keyword = keyword;
    }

    /** Returns the short keyword used in scripts and logs ({@code up} or {@code down}). */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a direction from either its keyword ({@code up}, {@code down}) or its name
     * ({@code forward}, {@code backward}), ignoring case.
     *
     * @throws IllegalArgumentException if the value names no direction
     */
    public static Direction fromKeyword(String value) {
        if (value == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Direction direction : values()) {
            if (direction.keyword.equals(normalized)
                    || direction.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown migration direction: " + value);
    }
}

package com.keel.migration;

import java.time.Duration;
import java.util.List;

/** Callbacks around each migration step. Implementations must not throw. */
public interface MigrationListener {

    /** Listener that ignores every event. */
    MigrationListener NOOP = new MigrationListener() {};

    default void onMigrationStarted(String name, Direction direction) {}

    default void onMigrationCompleted(String name, Direction direction, Duration elapsed) {}

    default void onMigrationFailed(
            String name, Direction direction, Duration elapsed, Throwable failure) {}

    /** Fans every event out to the given listeners, in order. */
    static MigrationListener composite(List<? extends MigrationListener> listeners) {
        List<MigrationListener> copy = List.copyOf(listeners);
        if (copy.isEmpty()) {
            return NOOP;
        }
        if (copy.size() == 1) {
            return copy.get(0);
        }
        return new MigrationListener() {
            @Override
            public void onMigrationStarted(String name, Direction direction) {
                copy.forEach(l -> l.onMigrationStarted(name, direction));
            }

            @Override
            public void onMigrationCompleted(String name, Direction direction, Duration elapsed) {
                copy.forEach(l -> l.onMigrationCompleted(name, direction, elapsed));
            }

            @Override
            public void onMigrationFailed(
                    String name, Direction direction, Duration elapsed, Throwable failure) {
                copy.forEach(l -> l.onMigrationFailed(name, direction, elapsed, failure));
            }
        };
    }
}

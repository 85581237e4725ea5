package com.keel.migrationrunner.metrics;

import com.keel.migration.Direction;
import com.keel.migration.MigrationListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Publishes a counter and a timer for every migration step.
 *
 * <p>Both meters are tagged with {@code direction} ({@code up} or {@code down}) and {@code
 * outcome} ({@code success} or {@code failure}).
 */
@Component
public class MicrometerMigrationListener implements MigrationListener {

    /** Counter of migration steps run. */
    public static final String EXECUTED = "keel.migrations.executed";

    /** Timer of migration step duration. */
    public static final String DURATION = "keel.migration.duration";

    public static final String TAG_DIRECTION = "direction";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    public MicrometerMigrationListener(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public void onMigrationCompleted(String name, Direction direction, Duration elapsed) {
        record(direction, "success", elapsed);
    }

    @Override
    public void onMigrationFailed(
            String name, Direction direction, Duration elapsed, Throwable failure) {
        record(direction, "failure", elapsed);
    }

    private void record(Direction direction, String outcome, Duration elapsed) {
        Tags tags = Tags.of(TAG_DIRECTION, direction.keyword(), TAG_OUTCOME, outcome);
        Counter.builder(EXECUTED)
                .description("Migration steps run")
                .tags(tags)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time spent running a migration step")
                .tags(tags)
                .register(registry)
                .record(elapsed);
    }
}

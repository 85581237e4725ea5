package com.keel.migrationrunner.health;

import com.keel.migration.MigrationManager;
import com.keel.migration.MigrationStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports the migration state as the {@code migrations} health component.
 *
 * <ul>
 *   <li>{@code UP}: every available migration is applied
 *   <li>{@code PENDING}: migrations await application
 *   <li>{@code DOWN}: the ledger or the migration sources cannot be read
 * </ul>
 */
@Component("migrationsHealthIndicator")
public class MigrationHealthIndicator implements HealthIndicator {

    /** Reported while migrations await application. */
    public static final Status PENDING = new Status("PENDING", "Migrations are pending");

    private final MigrationManager migrationManager;

    public MigrationHealthIndicator(MigrationManager migrationManager) {
        this.migrationManager = migrationManager;
    }

    @Override
    public Health health() {
        MigrationStatus status;
        try {
            status = migrationManager.status();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }

        Health.Builder builder = status.upToDate() ? Health.up() : Health.status(PENDING);
        builder.withDetail("available", status.available().size())
                .withDetail("applied", status.applied().size())
                .withDetail("pending", status.pending());
        if (status.currentVersion() != null) {
            builder.withDetail("currentVersion", status.currentVersion());
        }
        return builder.build();
    }
}

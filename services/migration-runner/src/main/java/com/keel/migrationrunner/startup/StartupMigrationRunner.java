package com.keel.migrationrunner.startup;

import com.keel.migration.MigrationException;
import com.keel.migration.MigrationManager;
import com.keel.migration.config.MigrationProperties;
import com.keel.migrationrunner.cli.MigrationCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Applies pending migrations while the application starts, when
 * {@code keel.migration.apply-on-startup} is set. Skipped when a command was given.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StartupMigrationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupMigrationRunner.class);

    private final MigrationManager migrationManager;
    private final MigrationProperties properties;

    public StartupMigrationRunner(
            MigrationManager migrationManager, MigrationProperties properties) {
        this.migrationManager = migrationManager;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.applyOnStartup()) {
            log.debug("Startup migration disabled");
            return;
        }
        if (MigrationCommand.isPresent(args.getSourceArgs())) {
            log.debug("Command given, skipping startup migration");
            return;
        }

        log.info("Applying pending migrations on startup");
        try {
            migrationManager.applyAllMigrations();
        } catch (MigrationException e) {
            if (properties.failOnStartupError()) {
                throw e;
            }
            log.warn("Startup migration failed, continuing: {}", e.getMessage());
        }
    }
}

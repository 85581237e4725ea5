package com.keel.migrationrunner;

import com.keel.migration.config.MigrationConfiguration;
import com.keel.migrationrunner.cli.MigrationCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Keel migration runner.
 *
 * <p>Started without arguments it serves the migration admin API and actuator endpoints, and
 * applies pending migrations first when {@code keel.migration.apply-on-startup} is set. Started
 * with a command it runs that command without a web server and exits:
 *
 * <pre>
 * java -jar migration-runner.jar migrate
 * java -jar migration-runner.jar status
 * java -jar migration-runner.jar rollback 002_create_tasks_table 001_create_agent_memory
 * java -jar migration-runner.jar new add_task_owner
 * </pre>
 */
@SpringBootApplication
@Import(MigrationConfiguration.class)
public class MigrationRunnerApplication {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunnerApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MigrationRunnerApplication.class);
        if (MigrationCommand.isPresent(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
        log.info("Keel migration runner started");
    }
}

package com.keel.migrationrunner.cli;

import com.keel.migration.MigrationException;
import com.keel.migration.MigrationManager;
import com.keel.migration.MigrationStatus;
import com.keel.migration.config.MigrationProperties;
import com.keel.migration.ledger.AppliedMigration;
import com.keel.migration.registry.ScriptDirectoryRegistry;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the command given on the command line, if any.
 *
 * <p>Exit codes: 0 on success, 1 when a migration fails, 2 on a usage error. Rollback names are
 * processed in the order given and the first failure stops the rest.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class MigrationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(MigrationCommandRunner.class);

    private final MigrationManager migrationManager;
    private final MigrationProperties properties;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public MigrationCommandRunner(
            MigrationManager migrationManager, MigrationProperties properties) {
        this(migrationManager, properties, System.out);
    }

    MigrationCommandRunner(
            MigrationManager migrationManager, MigrationProperties properties, PrintStream out) {
        this.migrationManager = migrationManager;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        List<String> commandLine = MigrationCommand.locate(positional);
        if (commandLine.isEmpty()) {
            log.warn("Ignoring positional arguments {}. {}", positional, MigrationCommand.USAGE);
            return;
        }
        if (commandLine.size() < positional.size()) {
            log.warn(
                    "Ignoring positional arguments {} before the command",
                    positional.subList(0, positional.size() - commandLine.size()));
        }
        MigrationCommand command;
        try {
            command = MigrationCommand.parse(commandLine);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }
        try {
            execute(command);
            exitCode = EXIT_OK;
        } catch (MigrationException e) {
            log.error("Command {} failed", command.verb(), e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void execute(MigrationCommand command) {
        switch (command.verb()) {
            case MIGRATE:
                List<String> applied = migrationManager.applyAllMigrations();
                out.println("Applied " + applied.size() + " migration(s)");
                applied.forEach(name -> out.println("  " + name));
                break;
            case STATUS:
                printStatus(migrationManager.status());
                break;
            case ROLLBACK:
                for (String name : command.arguments()) {
                    boolean rolledBack = migrationManager.rollbackMigration(name);
                    out.println((rolledBack ? "Rolled back " : "Not applied, skipped ") + name);
                }
                break;
            case NEW:
                Path script =
                        scriptRegistry().createScript(command.arguments().get(0), knownNames());
                out.println("Created " + script);
                break;
            default:
                throw new IllegalStateException("Unhandled command " + command.verb());
        }
    }

    private void printStatus(MigrationStatus status) {
        out.println(
                "Current version: "
                        + (status.currentVersion() == null ? "none" : status.currentVersion()));
        for (AppliedMigration migration : status.applied()) {
            out.println("  applied  " + migration.version() + "  " + migration.appliedAt());
        }
        for (String name : status.pending()) {
            out.println("  pending  " + name);
        }
    }

    // Manifest migrations own versions too; a new script must number after them.
    private List<String> knownNames() {
        return migrationManager.discoverMigrationFiles().stream()
                .map(migrationManager.registry()::nameOf)
                .collect(Collectors.toList());
    }

    private ScriptDirectoryRegistry scriptRegistry() {
        return new ScriptDirectoryRegistry(
                Path.of(properties.scriptsDirectory()), properties.scriptExtension());
    }
}

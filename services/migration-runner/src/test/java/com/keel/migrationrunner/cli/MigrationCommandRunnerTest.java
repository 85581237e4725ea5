package com.keel.migrationrunner.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.keel.migration.Direction;
import com.keel.migration.MigrationExecutionException;
import com.keel.migration.MigrationManager;
import com.keel.migration.MigrationStatus;
import com.keel.migration.config.MigrationProperties;
import com.keel.migration.ledger.AppliedMigration;
import com.keel.migration.registry.CompositeMigrationRegistry;
import com.keel.migration.registry.ManifestMigrationRegistry;
import com.keel.migration.registry.ScriptDirectoryRegistry;
import com.keel.migration.testing.InMemoryVersionLedger;
import com.keel.migration.testing.RecordingMigrationExecutor;
import com.keel.migrationrunner.migrations.CreateAgentMemory;
import com.keel.migrationrunner.migrations.CreateTasksTable;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.springframework.boot.DefaultApplicationArguments;

@DisplayName("MigrationCommandRunner")
class MigrationCommandRunnerTest {

    @TempDir Path scripts;

    private final MigrationManager manager = mock(MigrationManager.class);
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private MigrationProperties properties;
    private MigrationCommandRunner runner;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties(scripts.toString(), "sql", false, null, false, null);
        runner = runnerFor(manager);
    }

    @Test
    @DisplayName("without a command nothing runs")
    void noCommand() {
        runner.run(args("--server.port=0"));

        verifyNoInteractions(manager);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("migrate applies pending migrations and lists them")
    void migrate() {
        when(manager.applyAllMigrations()).thenReturn(List.of("001_a", "002_b"));

        runner.run(args("migrate"));

        assertThat(runner.getExitCode()).isZero();
        assertThat(printed()).contains("Applied 2 migration(s)").contains("002_b");
    }

    @Test
    @DisplayName("status prints applied and pending migrations")
    void status() {
        when(manager.status())
                .thenReturn(
                        new MigrationStatus(
                                List.of("001_a", "002_b"),
                                List.of(new AppliedMigration("001_a", Instant.EPOCH)),
                                List.of("002_b"),
                                "001_a"));

        runner.run(args("status"));

        assertThat(printed())
                .contains("Current version: 001_a")
                .contains("applied  001_a")
                .contains("pending  002_b");
    }

    @Test
    @DisplayName("rollback processes names in the order given")
    void rollbackInOrder() {
        when(manager.rollbackMigration("002_b")).thenReturn(true);
        when(manager.rollbackMigration("001_a")).thenReturn(false);

        runner.run(args("rollback", "002_b", "001_a"));

        InOrder order = inOrder(manager);
        order.verify(manager).rollbackMigration("002_b");
        order.verify(manager).rollbackMigration("001_a");
        assertThat(printed()).contains("Rolled back 002_b").contains("Not applied, skipped 001_a");
    }

    @Test
    @DisplayName("a failed rollback stops the remaining names and exits with 1")
    void rollbackFailure() {
        when(manager.rollbackMigration("002_b"))
                .thenThrow(
                        new MigrationExecutionException(
                                "002_b", Direction.BACKWARD, new IllegalStateException("locked")));

        runner.run(args("rollback", "002_b", "001_a"));

        verify(manager, never()).rollbackMigration("001_a");
        assertThat(runner.getExitCode()).isEqualTo(MigrationCommandRunner.EXIT_FAILED);
    }

    @Test
    @DisplayName("new writes a numbered script skeleton")
    void newScript() throws Exception {
        Files.writeString(scripts.resolve("001_init.sql"), "-- migrate:up\n");
        var scriptRegistry = new ScriptDirectoryRegistry(scripts);
        var scriptsOnly =
                new MigrationManager(
                        scriptRegistry,
                        new InMemoryVersionLedger(),
                        new RecordingMigrationExecutor());
        var scriptRunner = runnerFor(scriptsOnly);

        scriptRunner.run(args("new", "add_owner"));

        assertThat(scripts.resolve("002_add_owner.sql")).exists();
        assertThat(scriptRunner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("new numbers after built-in java migrations")
    void newScriptAfterBuiltIns() {
        var registry =
                new CompositeMigrationRegistry(
                        List.of(
                                new ScriptDirectoryRegistry(scripts),
                                new ManifestMigrationRegistry(
                                        List.of(new CreateAgentMemory(), new CreateTasksTable()))));
        var withBuiltIns =
                new MigrationManager(
                        registry, new InMemoryVersionLedger(), new RecordingMigrationExecutor());
        var builtInRunner = runnerFor(withBuiltIns);

        builtInRunner.run(args("new", "add_task_owner"));

        assertThat(scripts.resolve("003_add_task_owner.sql")).exists();
        assertThat(withBuiltIns.discoverMigrationFiles()).hasSize(3);
        assertThat(builtInRunner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("usage errors exit with 2")
    void usageError() {
        runner.run(args("rollback"));

        verifyNoInteractions(manager);
        assertThat(runner.getExitCode()).isEqualTo(MigrationCommandRunner.EXIT_USAGE);
    }

    @Test
    @DisplayName("positional values of spring options are not commands")
    void optionValueIsNotCommand() {
        runner.run(args("--spring.profiles.active", "test"));

        verifyNoInteractions(manager);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("a command after an option value still runs")
    void commandAfterOptionValue() {
        when(manager.applyAllMigrations()).thenReturn(List.of());

        runner.run(args("--spring.profiles.active", "prod", "migrate"));

        verify(manager).applyAllMigrations();
        assertThat(runner.getExitCode()).isZero();
    }

    private MigrationCommandRunner runnerFor(MigrationManager migrationManager) {
        return new MigrationCommandRunner(
                migrationManager,
                properties,
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}

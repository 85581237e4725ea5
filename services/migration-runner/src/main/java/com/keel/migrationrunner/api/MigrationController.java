package com.keel.migrationrunner.api;

import com.keel.migration.InvalidMigrationNameException;
import com.keel.migration.MigrationManager;
import com.keel.migration.MigrationNames;
import com.keel.migration.MigrationStatus;
import com.keel.migration.ledger.AppliedMigration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin API over the {@link MigrationManager}.
 *
 * <p>Calls are synchronous: {@code POST /apply} returns once every pending migration ran or the
 * first one failed. Failures are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/api/v1/migrations")
public class MigrationController {

    private final MigrationManager migrationManager;

    public MigrationController(MigrationManager migrationManager) {
        this.migrationManager = migrationManager;
    }

    @GetMapping
    public MigrationStatus status() {
        return migrationManager.status();
    }

    @GetMapping("/applied")
    public List<AppliedMigration> applied() {
        return migrationManager.getAppliedMigrations();
    }

    @GetMapping("/available")
    public List<String> available() {
        return migrationManager.discoverMigrationFiles().stream()
                .map(migrationManager.registry()::nameOf)
                .collect(Collectors.toList());
    }

    @PostMapping("/apply")
    public Map<String, Object> apply() {
        List<String> applied = migrationManager.applyAllMigrations();
        return Map.of("applied", applied, "count", applied.size());
    }

    @PostMapping("/{version}/rollback")
    public Map<String, Object> rollback(@PathVariable String version) {
        if (!MigrationNames.isValidName(version)) {
            throw new InvalidMigrationNameException("Invalid migration name format: " + version);
        }
        boolean rolledBack = migrationManager.rollbackMigration(version);
        return Map.of("version", version, "rolledBack", rolledBack);
    }
}

package com.keel.migration.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized migration settings, bound from {@code keel.migration.*}.
 *
 * <pre>{@code
 * keel:
 *   migration:
 *     scripts-directory: db/migrations
 *     script-extension: sql
 *     manifest-enabled: true
 *     ledger-table: schema_migrations
 *     apply-on-startup: false
 *     fail-on-startup-error: true
 * }</pre>
 *
 * @param scriptsDirectory directory scanned for {@code NNN_description.sql} scripts; a missing
 *     directory means no scripts
 * @param scriptExtension script file extension without the dot
 * @param manifestEnabled whether Java migrations listed in the service manifest are included
 * @param ledgerTable name of the version ledger table
 * @param applyOnStartup apply pending migrations while the application starts
 * @param failOnStartupError abort startup when the startup run fails, instead of logging a warning
 */
@Validated
@ConfigurationProperties(prefix = "keel.migration")
public record MigrationProperties(
        @NotBlank String scriptsDirectory,
        @NotBlank @Pattern(regexp = "^[a-zA-Z0-9]+$") String scriptExtension,
        Boolean manifestEnabled,
        @NotBlank @Pattern(regexp = "^[a-zA-Z_][a-zA-Z0-9_]*$") String ledgerTable,
        boolean applyOnStartup,
        Boolean failOnStartupError) {

    /** Applies defaults before Bean Validation runs. */
    public MigrationProperties {
        if (scriptsDirectory == null || scriptsDirectory.isBlank()) {
            scriptsDirectory = "db/migrations";
        }
        if (scriptExtension == null || scriptExtension.isBlank()) {
            scriptExtension = "sql";
        }
        if (manifestEnabled == null) {
            manifestEnabled = Boolean.TRUE;
        }
        if (ledgerTable == null || ledgerTable.isBlank()) {
            ledgerTable = "schema_migrations";
        }
        if (failOnStartupError == null) {
            failOnStartupError = Boolean.TRUE;
        }
    }
}

package com.keel.migration.config;

import com.keel.migration.MigrationExecutor;
import com.keel.migration.MigrationListener;
import com.keel.migration.MigrationManager;
import com.keel.migration.jdbc.JdbcTemplateMigrationExecutor;
import com.keel.migration.ledger.JdbcVersionLedger;
import com.keel.migration.ledger.VersionLedger;
import com.keel.migration.registry.CompositeMigrationRegistry;
import com.keel.migration.registry.ManifestMigrationRegistry;
import com.keel.migration.registry.MigrationRegistry;
import com.keel.migration.registry.ScriptDirectoryRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Spring wiring for the migration engine: one {@link MigrationManager} per application context.
 *
 * <p>Requires a {@link JdbcTemplate} bean, which Spring Boot provides when a {@code DataSource} is
 * configured. Import it from an application class:
 *
 * <pre>{@code
 * @SpringBootApplication
 * @Import(MigrationConfiguration.class)
 * public class MyApplication {}
 * }</pre>
 *
 * <p>Set {@code keel.migration.enabled=false} to leave the engine out entirely.
 */
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
@ConditionalOnProperty(
        prefix = "keel.migration",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class MigrationConfiguration {

    @Bean
    public MigrationExecutor migrationExecutor(JdbcTemplate jdbcTemplate) {
        return new JdbcTemplateMigrationExecutor(jdbcTemplate);
    }

    @Bean
    public VersionLedger versionLedger(
            MigrationExecutor migrationExecutor, MigrationProperties properties) {
        return new JdbcVersionLedger(migrationExecutor, properties.ledgerTable());
    }

    /** Scripts from the configured directory, plus manifest migrations when enabled. */
    @Bean
    public MigrationRegistry migrationRegistry(MigrationProperties properties) {
        List<MigrationRegistry> registries = new ArrayList<>();
        registries.add(
                new ScriptDirectoryRegistry(
                        Path.of(properties.scriptsDirectory()), properties.scriptExtension()));
        if (properties.manifestEnabled()) {
            registries.add(
                    ManifestMigrationRegistry.fromServiceLoader(
                            MigrationConfiguration.class.getClassLoader()));
        }
        return new CompositeMigrationRegistry(registries);
    }

    @Bean
    public MigrationManager migrationManager(
            MigrationRegistry migrationRegistry,
            VersionLedger versionLedger,
            MigrationExecutor migrationExecutor,
            ObjectProvider<MigrationListener> listeners) {
        MigrationListener listener =
                MigrationListener.composite(listeners.orderedStream().collect(Collectors.toList()));
        return new MigrationManager(migrationRegistry, versionLedger, migrationExecutor, listener);
    }
}

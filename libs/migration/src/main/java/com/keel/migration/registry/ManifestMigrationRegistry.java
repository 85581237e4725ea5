package com.keel.migration.registry;

import com.keel.migration.JavaMigration;
import com.keel.migration.MigrationLoadException;
import com.keel.migration.MigrationNames;
import com.keel.migration.MigrationSource;
import com.keel.migration.MigrationUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of {@link JavaMigration} classes known at build time.
 *
 * <p>The set of migrations is fixed when the registry is built: either passed in explicitly or read
 * from the {@code META-INF/services/com.keel.migration.JavaMigration} manifest with {@link
 * ServiceLoader}. Names are validated and checked for duplicates up front, so a bad manifest fails
 * at startup rather than halfway through a batch.
 */
public class ManifestMigrationRegistry implements MigrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ManifestMigrationRegistry.class);

    private final List<MigrationSource> entries;

    /**
     * @param migrations the migrations to expose
     * @throws MigrationLoadException on an invalid or duplicate name
     */
    public ManifestMigrationRegistry(Collection<? extends JavaMigration> migrations) {
        Map<String, JavaMigration> byName = new HashMap<>();
        List<ManifestEntry> sorted = new ArrayList<>();
        for (JavaMigration migration : migrations) {
            String name = migration.name();
            if (!MigrationNames.isValidName(name)) {
                throw new MigrationLoadException(
                        "Invalid migration name '"
                                + name
                                + "' declared by "
                                + migration.getClass().getName());
            }
            JavaMigration previous = byName.putIfAbsent(name, migration);
            if (previous != null) {
                throw new MigrationLoadException(
                        "Duplicate migration "
                                + name
                                + " declared by "
                                + previous.getClass().getName()
                                + " and "
                                + migration.getClass().getName());
            }
            sorted.add(new ManifestEntry(migration));
        }
        sorted.sort(Comparator.comparing(ManifestEntry::fileName));
        this.entries = List.copyOf(sorted);
    }

    /**
     * Builds a registry from the service manifest visible to the given class loader.
     *
     * @throws MigrationLoadException if a listed class cannot be instantiated
     */
    public static ManifestMigrationRegistry fromServiceLoader(ClassLoader classLoader) {
        List<JavaMigration> migrations = new ArrayList<>();
        try {
            for (JavaMigration migration : ServiceLoader.load(JavaMigration.class, classLoader)) {
                migrations.add(migration);
            }
        } catch (ServiceConfigurationError e) {
            throw new MigrationLoadException("Cannot load migration manifest", e);
        }
        log.info("Loaded {} migrations from manifest", migrations.size());
        return new ManifestMigrationRegistry(migrations);
    }

    @Override
    public List<MigrationSource> discover() {
        return entries;
    }

    @Override
    public MigrationUnit load(MigrationSource source) {
        if (!(source instanceof ManifestEntry entry)) {
            throw new MigrationLoadException("Not a manifest migration: " + source.location());
        }
        JavaMigration migration = entry.migration();
        return new MigrationUnit(
                migration.name(), migration::up, migration.reversible() ? migration::down : null);
    }

    @Override
    public boolean supports(MigrationSource source) {
        return source instanceof ManifestEntry;
    }
}

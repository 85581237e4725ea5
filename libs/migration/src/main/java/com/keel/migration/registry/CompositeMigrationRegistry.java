package com.keel.migration.registry;

import com.keel.migration.MigrationLoadException;
import com.keel.migration.MigrationSource;
import com.keel.migration.MigrationUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Presents several registries as one version-ordered sequence.
 *
 * <p>A migration name may come from one registry only.
 */
public class CompositeMigrationRegistry implements MigrationRegistry {

    private final List<MigrationRegistry> registries;

    public CompositeMigrationRegistry(List<? extends MigrationRegistry> registries) {
        if (registries == null || registries.isEmpty()) {
            throw new IllegalArgumentException("registries must not be empty");
        }
        this.registries = List.copyOf(registries);
    }

    /**
     * @throws MigrationLoadException if two registries provide the same migration name
     */
    @Override
    public List<MigrationSource> discover() {
        Map<String, MigrationSource> byName = new HashMap<>();
        List<MigrationSource> all = new ArrayList<>();
        for (MigrationRegistry registry : registries) {
            for (MigrationSource source : registry.discover()) {
                String name = registry.nameOf(source);
                MigrationSource previous = byName.putIfAbsent(name, source);
                if (previous != null) {
                    throw new MigrationLoadException(
                            "Migration "
                                    + name
                                    + " is provided twice: "
                                    + previous.location()
                                    + " and "
                                    + source.location());
                }
                all.add(source);
            }
        }
        all.sort(Comparator.comparing(this::nameOf));
        return all;
    }

    @Override
    public MigrationUnit load(MigrationSource source) {
        for (MigrationRegistry registry : registries) {
            if (registry.supports(source)) {
                return registry.load(source);
            }
        }
        throw new MigrationLoadException("No registry can load " + source.location());
    }

    @Override
    public boolean supports(MigrationSource source) {
        return registries.stream().anyMatch(r -> r.supports(source));
    }

    public List<MigrationRegistry> registries() {
        return registries;
    }
}

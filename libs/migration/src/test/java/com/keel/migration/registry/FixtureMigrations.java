package com.keel.migration.registry;

import com.keel.migration.JavaMigration;
import com.keel.migration.MigrationExecutor;

/** Java migrations listed in the test manifest. */
public final class FixtureMigrations {

    private FixtureMigrations() {}

    public static final class CreateWidgets implements JavaMigration {

        @Override
        public String name() {
            return "001_create_widgets";
        }

        @Override
        public void up(MigrationExecutor executor) {
            executor.execute("CREATE TABLE widgets (id BIGINT PRIMARY KEY)");
        }

        @Override
        public void down(MigrationExecutor executor) {
            executor.execute("DROP TABLE widgets");
        }
    }

    public static final class SeedWidgets implements JavaMigration {

        @Override
        public String name() {
            return "002_seed_widgets";
        }

        @Override
        public void up(MigrationExecutor executor) {
            executor.execute("INSERT INTO widgets (id) VALUES (?)", 1L);
        }

        @Override
        public void down(MigrationExecutor executor) {
            executor.execute("DELETE FROM widgets WHERE id = ?", 1L);
        }

        @Override
        public boolean reversible() {
            return false;
        }
    }
}

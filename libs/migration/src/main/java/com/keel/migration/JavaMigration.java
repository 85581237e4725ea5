package com.keel.migration;

/**
 * A migration written in Java.
 *
 * <p>Implementations are listed in the build-time manifest {@code
 * META-INF/services/com.keel.migration.JavaMigration} and picked up by {@link
 * com.keel.migration.registry.ManifestMigrationRegistry}. They need a public no-argument
 * constructor.
 *
 * <pre>{@code
 * public final class CreateAuditLog implements JavaMigration {
 *     public String name() { return "007_create_audit_log"; }
 *     public void up(MigrationExecutor db) { db.execute("CREATE TABLE audit_log (...)"); }
 *     public void down(MigrationExecutor db) { db.execute("DROP TABLE audit_log"); }
 * }
 * }</pre>
 */
public interface JavaMigration {

    /** Returns the migration name, {@code NNN_description}. */
    String name();

    /** Applies the schema change. */
    void up(MigrationExecutor executor) throws Exception;

    /** Undoes the schema change. Not called when {@link #reversible()} is false. */
    void down(MigrationExecutor executor) throws Exception;

    /** Whether {@link #down} is meaningful. Irreversible migrations cannot be rolled back. */
    default boolean reversible() {
        return true;
    }
}

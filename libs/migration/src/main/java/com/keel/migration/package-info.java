/**
 * Ordered, reversible schema migrations.
 *
 * <ul>
 *   <li>{@link com.keel.migration.MigrationManager} applies pending migrations and rolls back
 *       applied ones
 *   <li>{@link com.keel.migration.registry} discovers migrations: SQL scripts in a directory and
 *       Java migrations listed in the service manifest
 *   <li>{@link com.keel.migration.ledger} records which versions are applied
 *   <li>{@link com.keel.migration.config} wires the engine into a Spring context
 * </ul>
 *
 * <p>Migration names follow {@code NNN_description}; see {@link com.keel.migration.MigrationNames}.
 */
package com.keel.migration;

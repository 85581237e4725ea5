package com.keel.migration;

/** One direction of a schema change, run against a {@link MigrationExecutor}. */
@FunctionalInterface
public interface MigrationOperation {

    /**
     * Performs the schema change.
     *
     * @param executor the database executor
     * @throws Exception any failure; the manager wraps it in {@link MigrationExecutionException}
     */
    void apply(MigrationExecutor executor) throws Exception;
}

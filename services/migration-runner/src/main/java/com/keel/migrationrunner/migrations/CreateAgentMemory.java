package com.keel.migrationrunner.migrations;

import com.keel.migration.JavaMigration;
import com.keel.migration.MigrationExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@code agent_memory} table with a pgvector embedding column.
 *
 * <p>Requires PostgreSQL with the {@code vector} extension available. Embeddings have 1536
 * dimensions and are indexed with IVFFlat on cosine distance.
 */
public class CreateAgentMemory implements JavaMigration {

    private static final Logger log = LoggerFactory.getLogger(CreateAgentMemory.class);

    @Override
    public String name() {
        return "001_create_agent_memory";
    }

    @Override
    public void up(MigrationExecutor executor) {
        executor.execute("CREATE EXTENSION IF NOT EXISTS vector");
        executor.execute(
                "CREATE TABLE agent_memory ("
                        + "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), "
                        + "content TEXT NOT NULL, "
                        + "embedding vector(1536), "
                        + "metadata JSONB, "
                        + "created_at TIMESTAMPTZ DEFAULT NOW())");
        executor.execute(
                "CREATE INDEX idx_agent_memory_embedding ON agent_memory "
                        + "USING ivfflat (embedding vector_cosine_ops) WITH (lists = 100)");
        executor.execute(
                "CREATE INDEX idx_agent_memory_metadata ON agent_memory USING gin (metadata)");
        executor.execute(
                "CREATE INDEX idx_agent_memory_created_at ON agent_memory (created_at DESC)");
        log.info("agent_memory table and indexes created");
    }

    /** Drops the table; its indexes go with it. The extension stays installed. */
    @Override
    public void down(MigrationExecutor executor) {
        executor.execute("DROP TABLE IF EXISTS agent_memory");
    }
}

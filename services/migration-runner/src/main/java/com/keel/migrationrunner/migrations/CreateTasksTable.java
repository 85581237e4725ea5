package com.keel.migrationrunner.migrations;

import com.keel.migration.JavaMigration;
import com.keel.migration.MigrationExecutor;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@code tasks} table, its indexes, an {@code updated_at} trigger and the value
 * constraints on status, priority and field lengths. A sample task is inserted once.
 */
public class CreateTasksTable implements JavaMigration {

    private static final Logger log = LoggerFactory.getLogger(CreateTasksTable.class);

    static final List<String> INDEXES =
            List.of(
                    "CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_priority ON tasks(priority)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_agent_id ON tasks(agent_id)"
                            + " WHERE agent_id IS NOT NULL",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_channel_id ON tasks(channel_id)"
                            + " WHERE channel_id IS NOT NULL",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_created_at ON tasks(created_at)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_updated_at ON tasks(updated_at)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_status_priority"
                            + " ON tasks(status, priority)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_agent_status ON tasks(agent_id, status)"
                            + " WHERE agent_id IS NOT NULL",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_channel_status"
                            + " ON tasks(channel_id, status) WHERE channel_id IS NOT NULL",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_metadata ON tasks USING gin(metadata)");

    static final List<String> CONSTRAINTS =
            List.of(
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_status CHECK (status IN"
                            + " ('pending', 'in_progress', 'completed', 'failed', 'cancelled'))",
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_priority CHECK (priority IN"
                            + " ('low', 'medium', 'high', 'critical'))",
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_title_length"
                            + " CHECK (LENGTH(title) >= 1 AND LENGTH(title) <= 200)",
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_description_length"
                            + " CHECK (LENGTH(description) <= 2000)",
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_agent_id_length"
                            + " CHECK (agent_id IS NULL OR LENGTH(agent_id) <= 100)",
                    "ALTER TABLE tasks ADD CONSTRAINT check_tasks_channel_id_format"
                            + " CHECK (channel_id IS NULL OR channel_id ~ '^[0-9]{17,19}$')");

    @Override
    public String name() {
        return "002_create_tasks_table";
    }

    @Override
    public void up(MigrationExecutor executor) {
        executor.execute(
                "CREATE TABLE IF NOT EXISTS tasks ("
                        + "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), "
                        + "title VARCHAR(200) NOT NULL, "
                        + "description TEXT NOT NULL, "
                        + "status VARCHAR(20) NOT NULL DEFAULT 'pending', "
                        + "priority VARCHAR(20) NOT NULL DEFAULT 'medium', "
                        + "agent_id VARCHAR(100), "
                        // Discord snowflake, 17 to 19 digits
                        + "channel_id VARCHAR(19), "
                        + "created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                        + "updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(), "
                        + "metadata JSONB NOT NULL DEFAULT '{}'::jsonb)");
        INDEXES.forEach(executor::execute);

        executor.execute(
                "CREATE OR REPLACE FUNCTION update_tasks_updated_at() RETURNS TRIGGER AS $$\n"
                        + "BEGIN\n"
                        + "    NEW.updated_at = NOW();\n"
                        + "    RETURN NEW;\n"
                        + "END;\n"
                        + "$$ LANGUAGE plpgsql");
        executor.execute(
                "CREATE TRIGGER trigger_tasks_updated_at BEFORE UPDATE ON tasks"
                        + " FOR EACH ROW EXECUTE FUNCTION update_tasks_updated_at()");

        CONSTRAINTS.forEach(executor::execute);

        executor.execute(
                "INSERT INTO tasks (title, description, status, priority, metadata) "
                        + "SELECT 'Sample Task', 'This is a sample task for testing purposes', "
                        + "'pending', 'medium', "
                        + "'{\"sample\": true, \"created_by\": \"migration\"}'::jsonb "
                        + "WHERE NOT EXISTS "
                        + "(SELECT 1 FROM tasks WHERE metadata->>'sample' = 'true')");
        log.info("tasks table, indexes, trigger and constraints created");
    }

    @Override
    public void down(MigrationExecutor executor) {
        executor.execute("DROP TRIGGER IF EXISTS trigger_tasks_updated_at ON tasks");
        executor.execute("DROP FUNCTION IF EXISTS update_tasks_updated_at()");
        executor.execute("DROP TABLE IF EXISTS tasks CASCADE");
    }
}

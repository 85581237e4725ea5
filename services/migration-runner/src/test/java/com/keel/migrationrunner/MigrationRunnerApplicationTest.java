package com.keel.migrationrunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.keel.migrationrunner.metrics.MicrometerMigrationListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Runs the admin API against an H2 database in PostgreSQL mode, using the scripts under {@code
 * src/test/resources/db/scripts}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Migration Runner Application")
class MigrationRunnerApplicationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private JdbcTemplate jdbcTemplate;
    @Autowired private MeterRegistry meterRegistry;

    @Test
    @DisplayName("apply, inspect, roll back and re-apply through the API")
    void migrationLifecycle() throws Exception {
        mockMvc.perform(get("/api/v1/migrations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available.length()").value(2))
                .andExpect(jsonPath("$.pending[0]").value("001_create_widgets"))
                .andExpect(jsonPath("$.pending[1]").value("002_add_widget_color"))
                .andExpect(jsonPath("$.applied").isEmpty());

        mockMvc.perform(get("/actuator/health/migrations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));

        mockMvc.perform(post("/api/v1/migrations/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.applied[0]").value("001_create_widgets"))
                .andExpect(jsonPath("$.applied[1]").value("002_add_widget_color"));

        assertThat(
                        jdbcTemplate.queryForObject(
                                "SELECT color FROM widgets WHERE id = 1", String.class))
                .isEqualTo("grey");

        mockMvc.perform(get("/api/v1/migrations/applied"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].version").value("001_create_widgets"))
                .andExpect(jsonPath("$[0].appliedAt").isNotEmpty());

        mockMvc.perform(get("/actuator/health/migrations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.details.currentVersion").value("002_add_widget_color"));

        mockMvc.perform(post("/api/v1/migrations/002_add_widget_color/rollback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rolledBack").value(true));

        mockMvc.perform(post("/api/v1/migrations/002_add_widget_color/rollback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rolledBack").value(false));

        mockMvc.perform(get("/api/v1/migrations"))
                .andExpect(jsonPath("$.currentVersion").value("001_create_widgets"))
                .andExpect(jsonPath("$.pending[0]").value("002_add_widget_color"));

        mockMvc.perform(post("/api/v1/migrations/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied[0]").value("002_add_widget_color"));

        assertThat(
                        meterRegistry
                                .get(MicrometerMigrationListener.EXECUTED)
                                .tags("direction", "up", "outcome", "success")
                                .counter()
                                .count())
                .isEqualTo(3.0);
        assertThat(
                        meterRegistry
                                .get(MicrometerMigrationListener.DURATION)
                                .tags("direction", "down", "outcome", "success")
                                .timer()
                                .count())
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("lists available migrations")
    void availableMigrations() throws Exception {
        mockMvc.perform(get("/api/v1/migrations/available"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("001_create_widgets"))
                .andExpect(jsonPath("$[1]").value("002_add_widget_color"));
    }

    @Test
    @DisplayName("rejects a malformed migration name")
    void rejectsMalformedName() throws Exception {
        mockMvc.perform(post("/api/v1/migrations/drop-everything/rollback"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    @Test
    @DisplayName("rolling back a migration that was never applied is a no-op")
    void rollbackNeverApplied() throws Exception {
        mockMvc.perform(post("/api/v1/migrations/999_never_applied/rollback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rolledBack").value(false));
    }

    @Test
    @DisplayName("Actuator health endpoint is available")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}

package com.keel.migrationrunner.infrastructure.web;

import com.keel.migration.InvalidMigrationFormatException;
import com.keel.migration.InvalidMigrationNameException;
import com.keel.migration.MigrationException;
import com.keel.migration.MigrationExecutionException;
import com.keel.migration.MigrationLoadException;
import com.keel.migration.MigrationNotFoundException;
import com.keel.migration.MigrationSourceNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps migration failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://keel.dev/errors/migration-failed",
 *   "title": "Migration Failed",
 *   "status": 500,
 *   "detail": "Migration execution failed: 002_create_tasks_table (up): syntax error",
 *   "migration": "002_create_tasks_table",
 *   "direction": "up",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({MigrationNotFoundException.class, MigrationSourceNotFoundException.class})
    public ProblemDetail handleNotFound(MigrationException ex) {
        log.warn("Migration not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Migration Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler({InvalidMigrationNameException.class, IllegalArgumentException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(InvalidMigrationFormatException.class)
    public ProblemDetail handleInvalidFormat(InvalidMigrationFormatException ex) {
        log.warn("Invalid migration: {}", ex.getMessage());
        return problem(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "Invalid Migration Format",
                "invalid-format",
                ex.getMessage());
    }

    @ExceptionHandler(MigrationExecutionException.class)
    public ProblemDetail handleExecution(MigrationExecutionException ex) {
        // Already logged by the manager with the migration in the MDC.
        ProblemDetail problem =
                problem(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "Migration Failed",
                        "migration-failed",
                        ex.getMessage());
        problem.setProperty("migration", ex.getMigrationName());
        problem.setProperty("direction", ex.getDirection().keyword());
        return problem;
    }

    @ExceptionHandler(MigrationLoadException.class)
    public ProblemDetail handleLoad(MigrationLoadException ex) {
        log.error("Migration load error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Migration Load Error",
                "load-error",
                ex.getMessage());
    }

    @ExceptionHandler(MigrationException.class)
    public ProblemDetail handleMigration(MigrationException ex) {
        log.error("Migration error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR, "Migration Error", "migration", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://keel.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}

package com.flagship.bookkeeping.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint with a database round trip. Lighter than the actuator health endpoint.
 */
@RestController
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public HealthController(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now(clock).toString());

        Integer schemaVersion = schemaVersion();
        boolean databaseUp = schemaVersion != null;
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        if (databaseUp) {
            body.put("schema_version", schemaVersion);
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(503).body(body);
    }

    /**
     * Latest applied migration, or null when the database cannot be reached.
     */
    private Integer schemaVersion() {
        try {
            return jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(CAST(version AS INTEGER)), 0) FROM flyway_schema_history WHERE success",
                Integer.class);
        } catch (RuntimeException e) {
            log.warn("Health check database query failed: {}", e.getMessage());
            return null;
        }
    }
}

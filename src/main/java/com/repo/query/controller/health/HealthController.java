package com.repo.query.controller.health;

import com.repo.query.dto.HealthDto;
import com.repo.query.service.queue.AnalysisQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping(path = "${repo.path}")
public class HealthController {
    private final JdbcTemplate jdbcTemplate;
    private final AnalysisQueue analysisQueue;
    private final Duration pingTimeout;
    private final String version;

    public HealthController(
            JdbcTemplate jdbcTemplate,
            AnalysisQueue analysisQueue,
            @Value("${query.queue.ping-timeout:500ms}") Duration pingTimeout,
            @Value("${query.version:1.0.0}") String version
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.analysisQueue = analysisQueue;
        this.pingTimeout = pingTimeout;
        this.version = version;
    }

    /**
     * reports the database and task queue; the service is degraded when either is down
     *
     * @return
     */
    @GetMapping("/health")
    public ResponseEntity<HealthDto> health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("database", databaseUp() ? "up" : "down");
        services.put("queue", analysisQueue.ping(pingTimeout) ? "up" : "down");

        boolean healthy = services.values().stream().allMatch("up"::equals);
        return ResponseEntity.ok(HealthDto.builder()
                .status(healthy ? "healthy" : "degraded")
                .timestamp(Instant.now())
                .services(services)
                .version(version)
                .build());
    }

    private boolean databaseUp() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (RuntimeException err) {
            log.warn("Database health check failed: {}", err.getMessage());
            return false;
        }
    }
}

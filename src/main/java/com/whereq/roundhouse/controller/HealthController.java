package com.whereq.roundhouse.controller;

import com.whereq.roundhouse.store.CoordinationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and coordination store status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(2);

    private final CoordinationStore store;

    @GetMapping({"/health", "/ready"})
    @Operation(summary = "Health check", description = "Check if the service can reach its coordination store")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return store.ping()
                .timeout(PING_TIMEOUT)
                .then(Mono.fromSupplier(() -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "healthy");
                    health.put("service", "roundhouse");
                    return ResponseEntity.ok(health);
                }))
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "unhealthy");
                    health.put("service", "roundhouse");
                    health.put("error", "coordination store unreachable: " + e.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health));
                });
    }
}

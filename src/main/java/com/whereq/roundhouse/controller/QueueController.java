package com.whereq.roundhouse.controller;

import com.whereq.roundhouse.dto.WorkersResponse;
import com.whereq.roundhouse.exception.StoreUnavailableException;
import com.whereq.roundhouse.model.QueueStats;
import com.whereq.roundhouse.monitor.QueueMonitor;
import com.whereq.roundhouse.service.WorkerRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Queue depth and worker endpoints
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Queue", description = "Queue statistics and worker registry")
public class QueueController {

    private final QueueMonitor queueMonitor;
    private final WorkerRegistry workerRegistry;

    @GetMapping("/stats")
    @Operation(summary = "Queue stats", description = "Queue depths, pending callback retries and active workers")
    public Mono<ResponseEntity<QueueStats>> stats() {
        return queueMonitor.stats()
            .map(ResponseEntity::ok)
            .onErrorResume(StoreUnavailableException.class,
                e -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<QueueStats>build()));
    }

    @GetMapping("/workers")
    @Operation(summary = "Active workers", description = "List registered build workers")
    public Mono<ResponseEntity<WorkersResponse>> workers() {
        return workerRegistry.listActive()
            .map(WorkersResponse::of)
            .map(ResponseEntity::ok)
            .onErrorResume(StoreUnavailableException.class,
                e -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<WorkersResponse>build()));
    }
}

package com.whereq.roundhouse.controller;

import com.whereq.roundhouse.exception.StoreUnavailableException;
import com.whereq.roundhouse.model.QueueStats;
import com.whereq.roundhouse.monitor.QueueMonitor;
import com.whereq.roundhouse.service.WorkerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueueControllerTest {

    private final QueueMonitor monitor = mock(QueueMonitor.class);
    private final WorkerRegistry workerRegistry = mock(WorkerRegistry.class);
    private final WebTestClient client = WebTestClient
        .bindToController(new QueueController(monitor, workerRegistry))
        .build();

    @Test
    void statsAreReported() {
        when(monitor.stats()).thenReturn(Mono.just(QueueStats.builder()
            .priorityDepth(2)
            .fifoDepth(5)
            .pendingCallbacks(1)
            .activeWorkers(3)
            .build()));

        client.get().uri("/api/v1/stats")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.priority_depth").isEqualTo(2)
            .jsonPath("$.fifo_depth").isEqualTo(5)
            .jsonPath("$.total_depth").isEqualTo(7)
            .jsonPath("$.pending_callbacks").isEqualTo(1)
            .jsonPath("$.active_workers").isEqualTo(3);
    }

    @Test
    void statsUnavailableWhenStoreIsDown() {
        when(monitor.stats()).thenReturn(Mono.error(new StoreUnavailableException("timeout")));

        client.get().uri("/api/v1/stats")
            .exchange()
            .expectStatus().isEqualTo(503);
    }

    @Test
    void workersAreListed() {
        when(workerRegistry.listActive()).thenReturn(Mono.just(List.of("builder-a", "builder-b")));

        client.get().uri("/api/v1/workers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.count").isEqualTo(2)
            .jsonPath("$.workers[0]").isEqualTo("builder-a");
    }
}

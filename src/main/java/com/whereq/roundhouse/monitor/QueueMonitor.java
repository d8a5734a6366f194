package com.whereq.roundhouse.monitor;

import com.whereq.roundhouse.model.QueueStats;
import com.whereq.roundhouse.queue.FifoJobQueue;
import com.whereq.roundhouse.queue.PriorityJobQueue;
import com.whereq.roundhouse.service.CallbackRetryQueue;
import com.whereq.roundhouse.service.WorkerRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monitor queue depths and worker count
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueMonitor {

    private final PriorityJobQueue priorityQueue;
    private final FifoJobQueue fifoQueue;
    private final CallbackRetryQueue callbackRetryQueue;
    private final WorkerRegistry workerRegistry;
    private final MeterRegistry meterRegistry;

    private final AtomicLong priorityDepth = new AtomicLong();
    private final AtomicLong fifoDepth = new AtomicLong();
    private final AtomicLong pendingCallbacks = new AtomicLong();
    private final AtomicLong activeWorkers = new AtomicLong();

    @PostConstruct
    public void initialize() {
        // Register Prometheus gauges
        Gauge.builder("roundhouse.queue.priority.depth", priorityDepth::get)
            .description("Jobs waiting in the priority queue")
            .register(meterRegistry);

        Gauge.builder("roundhouse.queue.fifo.depth", fifoDepth::get)
            .description("Jobs waiting in the FIFO queue")
            .register(meterRegistry);

        Gauge.builder("roundhouse.callbacks.pending", pendingCallbacks::get)
            .description("Failed callbacks waiting for redelivery")
            .register(meterRegistry);

        Gauge.builder("roundhouse.workers.active", activeWorkers::get)
            .description("Registered build workers")
            .register(meterRegistry);

        log.info("QueueMonitor initialized");
    }

    /**
     * Read current queue depths from the store
     *
     * @return Mono with the stats
     */
    public Mono<QueueStats> stats() {
        return Mono.zip(
                priorityQueue.size(),
                fifoQueue.size(),
                callbackRetryQueue.pendingCount(),
                workerRegistry.listActive())
            .map(tuple -> QueueStats.builder()
                .priorityDepth(tuple.getT1())
                .fifoDepth(tuple.getT2())
                .pendingCallbacks(tuple.getT3())
                .activeWorkers(tuple.getT4().size())
                .build());
    }

    @Scheduled(fixedDelayString = "${roundhouse.monitor.refresh-interval:PT15S}")
    public void refresh() {
        try {
            QueueStats stats = stats().block();
            if (stats != null) {
                priorityDepth.set(stats.getPriorityDepth());
                fifoDepth.set(stats.getFifoDepth());
                pendingCallbacks.set(stats.getPendingCallbacks());
                activeWorkers.set(stats.getActiveWorkers());

                log.debug("Queue status: priority={}, fifo={}, callbacks={}, workers={}",
                    stats.getPriorityDepth(), stats.getFifoDepth(),
                    stats.getPendingCallbacks(), stats.getActiveWorkers());
            }
        } catch (Exception e) {
            log.warn("Failed to refresh queue metrics: {}", e.getMessage());
        }
    }
}

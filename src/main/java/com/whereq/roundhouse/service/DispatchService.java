package com.whereq.roundhouse.service;

import com.whereq.roundhouse.exception.InvalidStatusTransitionException;
import com.whereq.roundhouse.exception.JobNotFoundException;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.queue.FifoJobQueue;
import com.whereq.roundhouse.queue.PriorityJobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Hands queued jobs to workers.
 *
 * A claim pops from the priority queue first and falls back to a blocking pop on the FIFO
 * queue, so FIFO work waits as long as priority work keeps arriving. The pop is the only
 * point where concurrent claimers are serialized: whoever pops an id owns the job.
 */
@Slf4j
@Service
public class DispatchService {

    private final PriorityJobQueue priorityQueue;
    private final FifoJobQueue fifoQueue;
    private final JobStatusTracker statusTracker;

    private final Counter claimedCounter;
    private final Counter skippedCounter;

    public DispatchService(PriorityJobQueue priorityQueue, FifoJobQueue fifoQueue,
                           JobStatusTracker statusTracker, MeterRegistry meterRegistry) {
        this.priorityQueue = priorityQueue;
        this.fifoQueue = fifoQueue;
        this.statusTracker = statusTracker;

        this.claimedCounter = Counter.builder("roundhouse.jobs.claimed")
            .description("Number of build jobs claimed by workers")
            .register(meterRegistry);
        this.skippedCounter = Counter.builder("roundhouse.jobs.claim.skipped")
            .description("Number of popped jobs skipped because they were no longer queued")
            .register(meterRegistry);
    }

    /**
     * Claim the next job and mark it {@code building} for the given worker.
     *
     * Jobs cancelled while queued are dropped and the claim keeps looking. Until
     * {@code maxWait} has passed it may block on the FIFO queue; after that it still drains
     * whatever is immediately available, so a cancelled head never hides work behind it.
     * If a popped id has no record any more the id is consumed and the claim fails with
     * {@link JobNotFoundException}.
     *
     * @param workerId claiming worker
     * @param maxWait how long to wait for FIFO work
     * @return Mono with the claimed job, or empty if no work arrived in time
     */
    public Mono<BuildJob> claim(String workerId, Duration maxWait) {
        return Mono.defer(() -> claimBefore(workerId, System.nanoTime() + maxWait.toNanos()));
    }

    private Mono<BuildJob> claimBefore(String workerId, long deadlineNanos) {
        Duration remaining = Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));

        return nextJobId(remaining)
            .flatMap(jobId -> statusTracker.getJob(jobId)
                .doOnError(JobNotFoundException.class,
                    e -> log.warn("Job {} popped from queue but its record is gone", jobId))
                .flatMap(record -> {
                    if (record.getStatus() != JobStatus.QUEUED) {
                        return skip(workerId, jobId, record.getStatus(), deadlineNanos);
                    }
                    return statusTracker.updateStatus(jobId, JobStatus.BUILDING, workerId)
                        .thenReturn(record.getJob())
                        .doOnSuccess(job -> {
                            claimedCounter.increment();
                            log.info("Job {} claimed by worker {}: sha={}, priority={}",
                                jobId, workerId, job.shortSha(), job.getPriority());
                        })
                        // Cancelled between the read and the write
                        .onErrorResume(InvalidStatusTransitionException.class,
                            e -> skip(workerId, jobId, e.getFrom(), deadlineNanos));
                }));
    }

    private Mono<BuildJob> skip(String workerId, UUID jobId, JobStatus status, long deadlineNanos) {
        skippedCounter.increment();
        log.info("Skipping job {} in status {}", jobId, status);
        // Past the deadline the next pops no longer block
        return claimBefore(workerId, deadlineNanos);
    }

    private Mono<UUID> nextJobId(Duration maxWait) {
        return priorityQueue.poll(Duration.ZERO)
            .switchIfEmpty(Mono.defer(() -> fifoQueue.poll(maxWait)));
    }
}

package com.whereq.roundhouse.service;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.whereq.roundhouse.exception.InvalidStatusTransitionException;
import com.whereq.roundhouse.exception.JobValidationException;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.queue.FifoJobQueue;
import com.whereq.roundhouse.queue.JobQueue;
import com.whereq.roundhouse.queue.PriorityJobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Service for job admission and management
 */
@Slf4j
@Service
public class JobAdmissionService {

    private final JobStatusTracker statusTracker;
    private final PriorityJobQueue priorityQueue;
    private final FifoJobQueue fifoQueue;
    private final Clock clock;

    /**
     * Version 7 ids sort in generation order, which breaks score ties in the priority
     * queue by arrival.
     */
    private final TimeBasedEpochGenerator idGenerator = Generators.timeBasedEpochGenerator();

    private final Counter admittedCounter;
    private final Counter cancelledCounter;

    public JobAdmissionService(JobStatusTracker statusTracker, PriorityJobQueue priorityQueue,
                               FifoJobQueue fifoQueue, Clock clock, MeterRegistry meterRegistry) {
        this.statusTracker = statusTracker;
        this.priorityQueue = priorityQueue;
        this.fifoQueue = fifoQueue;
        this.clock = clock;

        this.admittedCounter = Counter.builder("roundhouse.jobs.admitted")
            .description("Number of build jobs admitted")
            .register(meterRegistry);
        this.cancelledCounter = Counter.builder("roundhouse.jobs.cancelled")
            .description("Number of build jobs cancelled")
            .register(meterRegistry);
    }

    /**
     * Admit a job for dispatch.
     *
     * Identity and admission time are assigned here; any values on the draft are replaced.
     * The record is written first and the id is then placed on the priority queue when
     * priority is above zero, otherwise on the FIFO queue. If any write fails the record
     * is removed again, so a job is either fully admitted or not visible.
     *
     * @param draft job description
     * @return Mono with the admitted job
     */
    public Mono<BuildJob> enqueue(BuildJob draft) {
        return validate(draft)
            .then(Mono.fromCallable(() -> draft.toBuilder()
                .id(idGenerator.generate())
                .createdAt(clock.instant())
                .build()))
            .flatMap(job -> statusTracker.create(job)
                .then(queueFor(job).offer(job))
                .onErrorResume(e -> {
                    log.warn("Failed to admit job {}, removing its record: {}", job.getId(), e.getMessage());
                    return statusTracker.delete(job.getId())
                        .onErrorResume(cleanup -> {
                            log.warn("Failed to remove record of job {}: {}", job.getId(), cleanup.getMessage());
                            return Mono.empty();
                        })
                        .then(Mono.<Void>error(e));
                })
                .thenReturn(job))
            .doOnSuccess(job -> {
                admittedCounter.increment();
                log.info("Job {} enqueued: service={}, sha={}, priority={}",
                    job.getId(), job.getServiceId(), job.shortSha(), job.getPriority());
            })
            .doOnError(e -> log.warn("Job admission failed: {}", e.getMessage()));
    }

    /**
     * Cancel a queued or building job. A cancelled job still referenced by a queue is
     * skipped when it is claimed.
     *
     * @param jobId job identifier
     * @return Mono that completes when cancelled; errors with
     *     {@link InvalidStatusTransitionException} if the job already finished
     */
    public Mono<Void> cancel(UUID jobId) {
        return statusTracker.getJob(jobId)
            .flatMap(record -> {
                if (record.getStatus().isTerminal()) {
                    return Mono.error(new InvalidStatusTransitionException(
                        jobId, record.getStatus(), JobStatus.CANCELLED));
                }
                return statusTracker.updateStatus(jobId, JobStatus.CANCELLED, null);
            })
            .doOnSuccess(v -> {
                cancelledCounter.increment();
                log.info("Job {} cancelled", jobId);
            });
    }

    /**
     * Re-admit a failed or cancelled job as a new job with priority raised by one
     *
     * @param jobId job identifier of the finished job
     * @return Mono with the new job
     */
    public Mono<BuildJob> retry(UUID jobId) {
        return statusTracker.getJob(jobId)
            .flatMap(record -> {
                JobStatus status = record.getStatus();
                if (status != JobStatus.FAILED && status != JobStatus.CANCELLED) {
                    return Mono.error(new InvalidStatusTransitionException(jobId, status, JobStatus.QUEUED));
                }
                BuildJob original = record.getJob();
                return enqueue(original.toBuilder()
                    .priority(original.getPriority() + 1)
                    .build());
            })
            .doOnSuccess(job -> log.info("Job {} retried as {}", jobId, job.getId()));
    }

    private JobQueue queueFor(BuildJob job) {
        return job.getPriority() > 0 ? priorityQueue : fifoQueue;
    }

    /**
     * Validate job description
     */
    private Mono<Void> validate(BuildJob draft) {
        return Mono.fromRunnable(() -> {
            if (draft == null) {
                throw new JobValidationException("Job must not be null");
            }
            if (draft.getReleaseId() == null) {
                throw new JobValidationException("release_id is required");
            }
            if (draft.getServiceId() == null) {
                throw new JobValidationException("service_id is required");
            }
            if (draft.getProjectId() == null) {
                throw new JobValidationException("project_id is required");
            }
            if (isBlank(draft.getGitRepo())) {
                throw new JobValidationException("git_repo is required");
            }
            if (isBlank(draft.getGitSha())) {
                throw new JobValidationException("git_sha is required");
            }
            if (draft.getBuildConfig() == null) {
                throw new JobValidationException("build_config is required");
            }
            if (draft.getPriority() < 0) {
                throw new JobValidationException("priority must not be negative");
            }
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.whereq.roundhouse.service;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.exception.InvalidStatusTransitionException;
import com.whereq.roundhouse.exception.JobNotFoundException;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.BuildResult;
import com.whereq.roundhouse.model.JobRecord;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.queue.JsonCodec;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.CoordinationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Track job records, status and results in the coordination store.
 *
 * A record is one hash per job holding the job body ({@code data}), the lifecycle fields
 * and, once the build ends, the result. It expires a fixed retention after admission.
 * Status updates and result writes touch only their own fields and re-assert that same
 * deadline, so they never rewrite the job body or extend its life.
 *
 * The status is never overwritten. Entering {@code building} writes {@code started_at}
 * and entering a terminal state writes {@code status}, each with put-if-absent, and the
 * current status is the furthest stage present. Concurrent writers therefore cannot move
 * a job backwards: a cancel racing a claim either lands first, and the claim sees it, or
 * lands on a job that is already building.
 */
@Slf4j
@Service
public class JobStatusTracker {

    static final String FIELD_DATA = "data";
    static final String FIELD_STATUS = "status";
    static final String FIELD_WORKER_ID = "worker_id";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_STARTED_AT = "started_at";
    static final String FIELD_COMPLETED_AT = "completed_at";
    static final String FIELD_RESULT = "result";

    private final CoordinationStore store;
    private final QueueKeys keys;
    private final JsonCodec codec;
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public JobStatusTracker(CoordinationStore store, QueueKeys keys, JsonCodec codec, Clock clock,
                            RoundhouseProperties properties) {
        this(store, keys, codec, clock, properties.getQueue().getJobRetention());
    }

    public JobStatusTracker(CoordinationStore store, QueueKeys keys, JsonCodec codec, Clock clock,
                            Duration retention) {
        this.store = store;
        this.keys = keys;
        this.codec = codec;
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Store a freshly admitted job. With no stage field written yet its status is {@code queued}.
     *
     * @param job job with identity and admission time assigned
     * @return Mono that completes when the record and its expiry are written
     */
    public Mono<Void> create(BuildJob job) {
        String key = keys.job(job.getId());
        return Mono.fromCallable(() -> codec.write(job))
            .flatMap(data -> {
                Map<String, String> fields = new HashMap<>();
                fields.put(FIELD_DATA, data);
                fields.put(FIELD_CREATED_AT, job.getCreatedAt().toString());
                return store.hashPutAll(key, fields);
            })
            .then(store.expireAt(key, job.getCreatedAt().plus(retention)))
            .then();
    }

    /**
     * Update job status without touching the job body
     *
     * @param jobId job identifier
     * @param status new status
     * @param workerId worker reporting the change, may be null
     * @return Mono that completes when updated; errors with {@link JobNotFoundException}
     *     or {@link InvalidStatusTransitionException}
     */
    public Mono<Void> updateStatus(UUID jobId, JobStatus status, String workerId) {
        String key = keys.job(jobId);

        return store.hashGetAll(key)
            .flatMap(fields -> {
                if (fields.isEmpty()) {
                    return Mono.error(new JobNotFoundException(jobId));
                }

                JobStatus current = currentStatus(fields);
                if (!current.canTransitionTo(status)) {
                    return Mono.error(new InvalidStatusTransitionException(jobId, current, status));
                }

                Mono<Void> transition;
                if (status == JobStatus.BUILDING) {
                    transition = enterBuilding(jobId, key, workerId);
                } else if (status.isTerminal()) {
                    transition = enterTerminal(jobId, key, status, workerId);
                } else {
                    transition = Mono.empty();
                }

                return transition
                    .then(reassertExpiry(key, fields))
                    .doOnSuccess(v -> log.info("Job {} status updated: {} → {}", jobId, current, status));
            });
    }

    private Mono<Void> enterBuilding(UUID jobId, String key, String workerId) {
        return store.hashPutIfAbsent(key, FIELD_STARTED_AT, clock.instant().toString())
            .then(store.hashGetAll(key))
            .flatMap(fields -> {
                if (fields.get(FIELD_DATA) == null) {
                    // Expired between the read and the write; drop the stray marker
                    return store.delete(key).then(Mono.<Void>error(new JobNotFoundException(jobId)));
                }
                JobStatus settled = currentStatus(fields);
                if (settled.isTerminal()) {
                    return Mono.error(new InvalidStatusTransitionException(jobId, settled, JobStatus.BUILDING));
                }
                return workerId == null
                    ? Mono.<Void>empty()
                    : store.hashPutAll(key, Map.of(FIELD_WORKER_ID, workerId));
            });
    }

    private Mono<Void> enterTerminal(UUID jobId, String key, JobStatus status, String workerId) {
        return store.hashPutIfAbsent(key, FIELD_STATUS, status.value())
            .flatMap(won -> {
                if (!won) {
                    return store.hashGet(key, FIELD_STATUS)
                        .flatMap(existing -> {
                            JobStatus settled = JobStatus.fromValue(existing);
                            return settled == status
                                ? Mono.<Void>empty()
                                : Mono.<Void>error(new InvalidStatusTransitionException(jobId, settled, status));
                        });
                }
                Map<String, String> updates = new HashMap<>();
                updates.put(FIELD_COMPLETED_AT, clock.instant().toString());
                if (workerId != null) {
                    updates.put(FIELD_WORKER_ID, workerId);
                }
                return store.hashPutAll(key, updates);
            });
    }

    /**
     * Store the build result. The first result written wins; later writes are ignored.
     *
     * @param jobId job identifier
     * @param result build outcome
     * @return Mono with true if this call stored the result
     */
    public Mono<Boolean> setResult(UUID jobId, BuildResult result) {
        String key = keys.job(jobId);

        return store.hashGetAll(key)
            .flatMap(fields -> {
                if (fields.isEmpty()) {
                    return Mono.error(new JobNotFoundException(jobId));
                }
                String data = codec.write(result);
                return store.hashPutIfAbsent(key, FIELD_RESULT, data)
                    .flatMap(stored -> reassertExpiry(key, fields).thenReturn(stored));
            })
            .doOnNext(stored -> {
                if (stored) {
                    log.info("Job {} result stored: success={}", jobId, result.isSuccess());
                } else {
                    log.warn("Job {} already has a result, ignoring second write", jobId);
                }
            });
    }

    /**
     * Get the job and its lifecycle fields
     *
     * @param jobId job identifier
     * @return Mono with the record; errors with {@link JobNotFoundException} if unknown or expired
     */
    public Mono<JobRecord> getJob(UUID jobId) {
        return store.hashGetAll(keys.job(jobId))
            .flatMap(fields -> {
                if (fields.isEmpty() || fields.get(FIELD_DATA) == null) {
                    log.debug("Job {} not found", jobId);
                    return Mono.error(new JobNotFoundException(jobId));
                }
                return Mono.just(parseRecord(fields));
            });
    }

    /**
     * Get the build result
     *
     * @param jobId job identifier
     * @return Mono with the result, or empty if none was stored or the job is unknown
     */
    public Mono<BuildResult> getResult(UUID jobId) {
        return store.hashGet(keys.job(jobId), FIELD_RESULT)
            .map(data -> codec.read(data, BuildResult.class));
    }

    /**
     * Delete a job record
     */
    public Mono<Void> delete(UUID jobId) {
        return store.delete(keys.job(jobId))
            .doOnSuccess(deleted -> log.info("Deleted job record {}: {} keys removed", jobId, deleted))
            .then();
    }

    private Mono<Void> reassertExpiry(String key, Map<String, String> fields) {
        String createdAt = fields.get(FIELD_CREATED_AT);
        if (createdAt == null) {
            return store.expire(key, retention).then();
        }
        return store.expireAt(key, Instant.parse(createdAt).plus(retention)).then();
    }

    private JobRecord parseRecord(Map<String, String> fields) {
        return JobRecord.builder()
            .job(codec.read(fields.get(FIELD_DATA), BuildJob.class))
            .status(currentStatus(fields))
            .workerId(emptyToNull(fields.get(FIELD_WORKER_ID)))
            .createdAt(parseInstant(fields.get(FIELD_CREATED_AT)))
            .startedAt(parseInstant(fields.get(FIELD_STARTED_AT)))
            .completedAt(parseInstant(fields.get(FIELD_COMPLETED_AT)))
            .build();
    }

    /**
     * Furthest stage recorded in a job hash
     */
    static JobStatus currentStatus(Map<String, String> fields) {
        String settled = fields.get(FIELD_STATUS);
        if (settled != null && !settled.isEmpty()) {
            return JobStatus.fromValue(settled);
        }
        return fields.containsKey(FIELD_STARTED_AT) ? JobStatus.BUILDING : JobStatus.QUEUED;
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

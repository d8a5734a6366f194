package com.whereq.roundhouse.service;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.model.FailedCallback;
import com.whereq.roundhouse.queue.JsonCodec;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.CoordinationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Failed callbacks waiting for redelivery.
 *
 * Each attempt is a hash holding its JSON body, indexed by a sorted set scored with the
 * next retry time in epoch milliseconds. Claiming removes an attempt from the index, and
 * only the caller whose removal succeeded gets it. Attempts expire a fixed retention after
 * they were first scheduled, however often they were retried.
 */
@Slf4j
@Service
public class CallbackRetryQueue {

    static final String FIELD_DATA = "data";
    static final String FIELD_CREATED_AT = "created_at";

    private final CoordinationStore store;
    private final QueueKeys keys;
    private final JsonCodec codec;
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public CallbackRetryQueue(CoordinationStore store, QueueKeys keys, JsonCodec codec, Clock clock,
                              RoundhouseProperties properties) {
        this(store, keys, codec, clock, properties.getCallback().getRetention());
    }

    public CallbackRetryQueue(CoordinationStore store, QueueKeys keys, JsonCodec codec, Clock clock,
                              Duration retention) {
        this.store = store;
        this.keys = keys;
        this.codec = codec;
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Schedule a failed callback for redelivery
     *
     * @param draft attempt with job, target, payload, attempt count and next retry time
     * @return Mono with the stored attempt, identity and creation time assigned
     */
    public Mono<FailedCallback> scheduleRetry(FailedCallback draft) {
        return Mono.fromCallable(() -> draft.toBuilder()
                .id(UUID.randomUUID())
                .createdAt(clock.instant())
                .build())
            .flatMap(attempt -> {
                String key = keys.callback(attempt.getId());
                return store.hashPutAll(key, Map.of(
                        FIELD_DATA, codec.write(attempt),
                        FIELD_CREATED_AT, attempt.getCreatedAt().toString()))
                    .then(store.expireAt(key, attempt.getCreatedAt().plus(retention)))
                    .then(store.sortedSetAdd(keys.callbackRetry(), attempt.getId().toString(),
                        score(attempt.getNextRetry())))
                    .thenReturn(attempt);
            })
            .doOnSuccess(attempt -> log.info("Callback for job {} queued for retry: attempt={}, id={}, next={}",
                attempt.getJobId(), attempt.getAttempts(), attempt.getId(), attempt.getNextRetry()));
    }

    /**
     * Schedule a bare retry for a job
     *
     * @param jobId job whose callback failed
     * @param nextRetryAt when the attempt becomes due
     * @return Mono with the attempt identifier
     */
    public Mono<UUID> scheduleRetry(UUID jobId, Instant nextRetryAt) {
        return scheduleRetry(FailedCallback.builder()
                .jobId(jobId)
                .nextRetry(nextRetryAt)
                .build())
            .map(FailedCallback::getId);
    }

    /**
     * Claim attempts that are due. Each returned attempt has been removed from the index
     * and is invisible to other callers until it is rescheduled.
     *
     * @param limit maximum number of attempts to claim
     * @return Flux of claimed attempts, soonest due first
     */
    public Flux<FailedCallback> claimReady(int limit) {
        String index = keys.callbackRetry();

        return Flux.defer(() -> store.rangeByScore(index, score(clock.instant()), limit))
            .concatMap(member -> store.sortedSetRemove(index, member)
                // Another caller got it first
                .filter(Boolean::booleanValue)
                .flatMap(removed -> store.hashGet(keys.callback(UUID.fromString(member)), FIELD_DATA)
                    .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Callback attempt {} has no data, dropping", member))))
                .map(data -> codec.read(data, FailedCallback.class)));
    }

    /**
     * Put a claimed attempt back with a later due time and one more attempt counted.
     *
     * @param attempt claimed attempt
     * @param newNextRetry new due time, strictly after the current one
     * @param lastError failure that caused the reschedule, may be null
     * @return Mono with the updated attempt, or empty if the attempt outlived its retention
     */
    public Mono<FailedCallback> reschedule(FailedCallback attempt, Instant newNextRetry, String lastError) {
        if (attempt.getNextRetry() != null && !newNextRetry.isAfter(attempt.getNextRetry())) {
            return Mono.error(new IllegalArgumentException(
                "Next retry " + newNextRetry + " is not after " + attempt.getNextRetry()));
        }

        String key = keys.callback(attempt.getId());
        Instant expiresAt = attempt.getCreatedAt().plus(retention);

        if (!expiresAt.isAfter(clock.instant())) {
            log.warn("Callback attempt {} for job {} is past retention, dropping", attempt.getId(), attempt.getJobId());
            return abandon(attempt.getId()).then(Mono.empty());
        }

        FailedCallback updated = attempt.toBuilder()
            .attempts(attempt.getAttempts() + 1)
            .nextRetry(newNextRetry)
            .lastError(lastError)
            .build();

        return store.hashPutAll(key, Map.of(
                FIELD_DATA, codec.write(updated),
                FIELD_CREATED_AT, updated.getCreatedAt().toString()))
            .then(store.expireAt(key, expiresAt))
            .then(store.sortedSetAdd(keys.callbackRetry(), updated.getId().toString(), score(newNextRetry)))
            .thenReturn(updated)
            .doOnSuccess(a -> log.info("Callback attempt {} for job {} rescheduled: attempt={}, next={}",
                a.getId(), a.getJobId(), a.getAttempts(), a.getNextRetry()));
    }

    /**
     * Remove an attempt for good, after delivery succeeded or retries ran out
     */
    public Mono<Void> abandon(UUID attemptId) {
        return store.delete(keys.callback(attemptId))
            .then(store.sortedSetRemove(keys.callbackRetry(), attemptId.toString()))
            .doOnSuccess(removed -> log.debug("Callback attempt {} removed", attemptId))
            .then();
    }

    /**
     * Get number of attempts waiting for redelivery
     */
    public Mono<Long> pendingCount() {
        return store.sortedSetSize(keys.callbackRetry());
    }

    private static double score(Instant instant) {
        return (double) instant.toEpochMilli();
    }
}

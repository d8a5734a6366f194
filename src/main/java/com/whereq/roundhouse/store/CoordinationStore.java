package com.whereq.roundhouse.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Shared data-structure store the dispatch queue coordinates through.
 *
 * Every guarantee that must hold across independent worker processes (single claim,
 * single callback-attempt claim) comes from the atomic primitives below, never from
 * in-process locking. Implementations signal {@link com.whereq.roundhouse.exception.StoreUnavailableException}
 * when the store cannot be reached.
 */
public interface CoordinationStore {

    // ---- hashes ----

    /**
     * Set several fields of a hash, creating it if needed.
     */
    Mono<Void> hashPutAll(String key, Map<String, String> fields);

    /**
     * Set a field only if it is not present yet.
     *
     * @return true if the field was written
     */
    Mono<Boolean> hashPutIfAbsent(String key, String field, String value);

    /**
     * @return the field value, or empty if the key or field is absent
     */
    Mono<String> hashGet(String key, String field);

    /**
     * @return all fields of the hash; an empty map if the key is absent
     */
    Mono<Map<String, String>> hashGetAll(String key);

    // ---- key expiry ----

    Mono<Boolean> expire(String key, Duration ttl);

    Mono<Boolean> expireAt(String key, Instant deadline);

    Mono<Long> delete(String key);

    // ---- sorted sets ----

    Mono<Boolean> sortedSetAdd(String key, String member, double score);

    /**
     * Atomically remove and return the lowest-scored member. Two concurrent callers never
     * receive the same member.
     *
     * @return the removed member, or empty if the set is empty
     */
    Mono<ScoredMember> popMin(String key);

    /**
     * Members with a score at or below {@code maxScore}, lowest first, at most {@code limit}.
     */
    Flux<String> rangeByScore(String key, double maxScore, int limit);

    /**
     * @return true only for the caller whose removal actually took the member out
     */
    Mono<Boolean> sortedSetRemove(String key, String member);

    Mono<Long> sortedSetSize(String key);

    // ---- lists ----

    /**
     * Push onto the head of the list.
     */
    Mono<Long> listPush(String key, String value);

    /**
     * Block up to {@code timeout} for the tail element and remove it.
     *
     * @return the element, or empty on timeout
     */
    Mono<String> listBlockingPop(String key, Duration timeout);

    Mono<Long> listSize(String key);

    // ---- streams ----

    /**
     * Append an entry to the stream.
     *
     * @return the store-assigned entry id
     */
    Mono<String> streamAppend(String key, Map<String, String> fields);

    /**
     * Read entries strictly after {@code afterId}, blocking up to {@code block} when none
     * are available yet. Completes empty on timeout.
     */
    Flux<StreamEntry> streamRead(String key, String afterId, int count, Duration block);

    // ---- sets ----

    Mono<Boolean> setAdd(String key, String member);

    Mono<Boolean> setRemove(String key, String member);

    Flux<String> setMembers(String key);

    /**
     * Round-trip used by health checks.
     */
    Mono<Void> ping();
}

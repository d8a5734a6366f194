package com.whereq.roundhouse.support;

import com.whereq.roundhouse.store.InMemoryCoordinationStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store that lets a test run an action right before a given hash field is
 * written, or make expiry writes fail.
 */
public class InterceptingCoordinationStore extends InMemoryCoordinationStore {

    private final Map<String, Runnable> beforePutIfAbsent = new ConcurrentHashMap<>();
    private final AtomicReference<RuntimeException> expireAtFailure = new AtomicReference<>();
    private final List<String> failedExpireKeys = new CopyOnWriteArrayList<>();

    public InterceptingCoordinationStore(Clock clock) {
        super(clock);
    }

    /**
     * Run {@code action} once, just before the next put-if-absent of {@code field}
     */
    public void beforePutIfAbsent(String field, Runnable action) {
        beforePutIfAbsent.put(field, action);
    }

    public void failExpireAt(RuntimeException failure) {
        expireAtFailure.set(failure);
    }

    public List<String> getFailedExpireKeys() {
        return failedExpireKeys;
    }

    @Override
    public Mono<Boolean> hashPutIfAbsent(String key, String field, String value) {
        return Mono.defer(() -> {
            Runnable action = beforePutIfAbsent.remove(field);
            if (action != null) {
                action.run();
            }
            return super.hashPutIfAbsent(key, field, value);
        });
    }

    @Override
    public Mono<Boolean> expireAt(String key, Instant deadline) {
        return Mono.defer(() -> {
            RuntimeException failure = expireAtFailure.get();
            if (failure != null) {
                failedExpireKeys.add(key);
                return Mono.error(failure);
            }
            return super.expireAt(key, deadline);
        });
    }
}

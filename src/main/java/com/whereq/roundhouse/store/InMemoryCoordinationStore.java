package com.whereq.roundhouse.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * In-process coordination store with Redis semantics.
 *
 * Every primitive runs under one monitor, which plays the role of Redis' single command
 * thread: a pop is atomic with respect to every other command. Expiry is evaluated lazily
 * against the injected {@link Clock}; blocking reads poll every {@value #POLL_MILLIS} ms.
 * Empty collections are removed together with their expiry, as Redis does.
 *
 * Intended for tests and single-process development runs
 * ({@code roundhouse.store.type=memory}).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "roundhouse.store", name = "type", havingValue = "memory")
public class InMemoryCoordinationStore implements CoordinationStore {

    private static final long POLL_MILLIS = 10;
    private static final Duration POLL_INTERVAL = Duration.ofMillis(POLL_MILLIS);

    private static final Comparator<ScoredMember> BY_SCORE = Comparator
        .comparingDouble(ScoredMember::getScore)
        .thenComparing(ScoredMember::getMember);

    private final Clock clock;
    private final Object monitor = new Object();

    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
        log.info("Using in-memory coordination store; state is not shared across processes");
    }

    // ---- hashes ----

    @Override
    public Mono<Void> hashPutAll(String key, Map<String, String> fields) {
        return Mono.fromRunnable(() -> {
            synchronized (monitor) {
                hash(key, true).putAll(fields);
            }
        });
    }

    @Override
    public Mono<Boolean> hashPutIfAbsent(String key, String field, String value) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                return hash(key, true).putIfAbsent(field, value) == null;
            }
        });
    }

    @Override
    public Mono<String> hashGet(String key, String field) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                Map<String, String> hash = hash(key, false);
                return hash == null ? null : hash.get(field);
            }
        });
    }

    @Override
    public Mono<Map<String, String>> hashGetAll(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                Map<String, String> hash = hash(key, false);
                return hash == null ? Map.<String, String>of() : Map.copyOf(hash);
            }
        });
    }

    // ---- expiry ----

    @Override
    public Mono<Boolean> expire(String key, Duration ttl) {
        return expireAt(key, clock.instant().plus(ttl));
    }

    @Override
    public Mono<Boolean> expireAt(String key, Instant deadline) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                if (!exists(key)) {
                    return false;
                }
                if (!deadline.isAfter(clock.instant())) {
                    remove(key);
                } else {
                    expiries.put(key, deadline);
                }
                return true;
            }
        });
    }

    @Override
    public Mono<Long> delete(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                boolean existed = exists(key);
                remove(key);
                return existed ? 1L : 0L;
            }
        });
    }

    // ---- sorted sets ----

    @Override
    public Mono<Boolean> sortedSetAdd(String key, String member, double score) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                SortedSetValue zset = sortedSet(key, true);
                Double previous = zset.scores.put(member, score);
                if (previous != null) {
                    zset.ordered.remove(new ScoredMember(member, previous));
                }
                zset.ordered.add(new ScoredMember(member, score));
                return previous == null;
            }
        });
    }

    @Override
    public Mono<ScoredMember> popMin(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                SortedSetValue zset = sortedSet(key, false);
                if (zset == null) {
                    return null;
                }
                ScoredMember first = zset.ordered.pollFirst();
                zset.scores.remove(first.getMember());
                removeIfEmpty(key, zset.ordered.isEmpty());
                return first;
            }
        });
    }

    @Override
    public Flux<String> rangeByScore(String key, double maxScore, int limit) {
        return Flux.defer(() -> {
            synchronized (monitor) {
                SortedSetValue zset = sortedSet(key, false);
                if (zset == null) {
                    return Flux.<String>empty();
                }
                List<String> members = new ArrayList<>();
                for (ScoredMember entry : zset.ordered) {
                    if (entry.getScore() > maxScore || members.size() >= limit) {
                        break;
                    }
                    members.add(entry.getMember());
                }
                return Flux.fromIterable(members);
            }
        });
    }

    @Override
    public Mono<Boolean> sortedSetRemove(String key, String member) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                SortedSetValue zset = sortedSet(key, false);
                if (zset == null) {
                    return false;
                }
                Double score = zset.scores.remove(member);
                if (score == null) {
                    return false;
                }
                zset.ordered.remove(new ScoredMember(member, score));
                removeIfEmpty(key, zset.ordered.isEmpty());
                return true;
            }
        });
    }

    @Override
    public Mono<Long> sortedSetSize(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                SortedSetValue zset = sortedSet(key, false);
                return zset == null ? 0L : (long) zset.ordered.size();
            }
        });
    }

    // ---- lists ----

    @Override
    public Mono<Long> listPush(String key, String value) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                Deque<String> list = list(key, true);
                list.addFirst(value);
                return (long) list.size();
            }
        });
    }

    @Override
    public Mono<String> listBlockingPop(String key, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Mono.fromSupplier(() -> popTail(key));
        }
        return Flux.defer(() -> {
                long deadline = System.nanoTime() + timeout.toNanos();
                return Flux.interval(Duration.ZERO, POLL_INTERVAL)
                    .onBackpressureDrop()
                    .takeWhile(tick -> tick == 0 || System.nanoTime() < deadline)
                    .map(tick -> Optional.ofNullable(popTail(key)));
            })
            .filter(Optional::isPresent)
            .map(Optional::get)
            .next();
    }

    @Override
    public Mono<Long> listSize(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                Deque<String> list = list(key, false);
                return list == null ? 0L : (long) list.size();
            }
        });
    }

    // ---- streams ----

    @Override
    public Mono<String> streamAppend(String key, Map<String, String> fields) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                StreamValue stream = stream(key, true);
                long now = clock.millis();
                if (now > stream.lastMillis) {
                    stream.lastMillis = now;
                    stream.lastSequence = 0;
                } else {
                    stream.lastSequence++;
                }
                String id = stream.lastMillis + "-" + stream.lastSequence;
                stream.entries.add(new StreamEntry(id, Map.copyOf(fields)));
                return id;
            }
        });
    }

    @Override
    public Flux<StreamEntry> streamRead(String key, String afterId, int count, Duration block) {
        if (block == null || block.isZero() || block.isNegative()) {
            return Flux.defer(() -> Flux.fromIterable(readAfter(key, afterId, count)));
        }
        return Flux.defer(() -> {
                long deadline = System.nanoTime() + block.toNanos();
                return Flux.interval(Duration.ZERO, POLL_INTERVAL)
                    .onBackpressureDrop()
                    .takeWhile(tick -> tick == 0 || System.nanoTime() < deadline)
                    .map(tick -> readAfter(key, afterId, count));
            })
            .filter(batch -> !batch.isEmpty())
            .next()
            .flatMapMany(Flux::fromIterable);
    }

    // ---- sets ----

    @Override
    public Mono<Boolean> setAdd(String key, String member) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                return set(key, true).add(member);
            }
        });
    }

    @Override
    public Mono<Boolean> setRemove(String key, String member) {
        return Mono.fromSupplier(() -> {
            synchronized (monitor) {
                Set<String> set = set(key, false);
                if (set == null) {
                    return false;
                }
                boolean removed = set.remove(member);
                removeIfEmpty(key, set.isEmpty());
                return removed;
            }
        });
    }

    @Override
    public Flux<String> setMembers(String key) {
        return Flux.defer(() -> {
            synchronized (monitor) {
                Set<String> set = set(key, false);
                return set == null ? Flux.<String>empty() : Flux.fromIterable(List.copyOf(set));
            }
        });
    }

    @Override
    public Mono<Void> ping() {
        return Mono.empty();
    }

    // ---- internals, all called with the monitor held ----

    private String popTail(String key) {
        synchronized (monitor) {
            Deque<String> list = list(key, false);
            if (list == null) {
                return null;
            }
            String value = list.pollLast();
            removeIfEmpty(key, list.isEmpty());
            return value;
        }
    }

    private List<StreamEntry> readAfter(String key, String afterId, int count) {
        synchronized (monitor) {
            StreamValue stream = stream(key, false);
            if (stream == null) {
                return List.of();
            }
            long[] after = parseId(afterId);
            List<StreamEntry> batch = new ArrayList<>();
            for (StreamEntry entry : stream.entries) {
                if (batch.size() >= count) {
                    break;
                }
                if (compareIds(parseId(entry.getId()), after) > 0) {
                    batch.add(entry);
                }
            }
            return batch;
        }
    }

    private static long[] parseId(String id) {
        if (id == null || id.isBlank()) {
            return new long[] {0, 0};
        }
        int dash = id.indexOf('-');
        if (dash < 0) {
            return new long[] {Long.parseLong(id), 0};
        }
        return new long[] {Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1))};
    }

    private static int compareIds(long[] a, long[] b) {
        int byMillis = Long.compare(a[0], b[0]);
        return byMillis != 0 ? byMillis : Long.compare(a[1], b[1]);
    }

    private boolean exists(String key) {
        purgeIfExpired(key);
        return values.containsKey(key);
    }

    private void purgeIfExpired(String key) {
        Instant deadline = expiries.get(key);
        if (deadline != null && !deadline.isAfter(clock.instant())) {
            remove(key);
        }
    }

    private void remove(String key) {
        values.remove(key);
        expiries.remove(key);
    }

    private void removeIfEmpty(String key, boolean empty) {
        if (empty) {
            remove(key);
        }
    }

    private Map<String, String> hash(String key, boolean create) {
        HashValue hash = typed(key, HashValue.class, create ? HashValue::new : null);
        return hash == null ? null : hash.fields;
    }

    private SortedSetValue sortedSet(String key, boolean create) {
        return typed(key, SortedSetValue.class, create ? SortedSetValue::new : null);
    }

    private Deque<String> list(String key, boolean create) {
        ListValue list = typed(key, ListValue.class, create ? ListValue::new : null);
        return list == null ? null : list.elements;
    }

    private StreamValue stream(String key, boolean create) {
        return typed(key, StreamValue.class, create ? StreamValue::new : null);
    }

    private Set<String> set(String key, boolean create) {
        SetValue set = typed(key, SetValue.class, create ? SetValue::new : null);
        return set == null ? null : set.members;
    }

    private <T> T typed(String key, Class<T> type, Supplier<? extends T> factory) {
        purgeIfExpired(key);
        Object value = values.get(key);
        if (value == null) {
            if (factory == null) {
                return null;
            }
            T created = factory.get();
            values.put(key, created);
            return created;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("WRONGTYPE key " + key + " holds another kind of value");
        }
        return type.cast(value);
    }

    private static final class HashValue {
        private final Map<String, String> fields = new LinkedHashMap<>();
    }

    private static final class ListValue {
        private final Deque<String> elements = new ArrayDeque<>();
    }

    private static final class SetValue {
        private final Set<String> members = new LinkedHashSet<>();
    }

    private static final class SortedSetValue {
        private final TreeSet<ScoredMember> ordered = new TreeSet<>(BY_SCORE);
        private final Map<String, Double> scores = new HashMap<>();
    }

    private static final class StreamValue {
        private final List<StreamEntry> entries = new ArrayList<>();
        private long lastMillis = -1;
        private long lastSequence;
    }
}

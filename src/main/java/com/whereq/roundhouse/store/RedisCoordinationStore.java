package com.whereq.roundhouse.store;

import com.whereq.roundhouse.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Redis-backed coordination store.
 *
 * Hashes, sorted sets, lists, streams and sets map one-to-one onto the Redis types of the
 * same name. {@link #popMin} is ZPOPMIN and {@link #listBlockingPop} is BRPOP, so the
 * single-claim guarantee holds across processes. Blocking commands run on a dedicated
 * connection inside Lettuce, they never stall the shared one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "roundhouse.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisCoordinationStore implements CoordinationStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    @Override
    public Mono<Void> hashPutAll(String key, Map<String, String> fields) {
        return redisTemplate.<String, String>opsForHash()
            .putAll(key, fields)
            .then()
            .transform(this::guardMono);
    }

    @Override
    public Mono<Boolean> hashPutIfAbsent(String key, String field, String value) {
        return redisTemplate.<String, String>opsForHash()
            .putIfAbsent(key, field, value)
            .transform(this::guardMono);
    }

    @Override
    public Mono<String> hashGet(String key, String field) {
        return redisTemplate.<String, String>opsForHash()
            .get(key, field)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Map<String, String>> hashGetAll(String key) {
        return redisTemplate.<String, String>opsForHash()
            .entries(key)
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Boolean> expire(String key, Duration ttl) {
        return redisTemplate.expire(key, ttl).transform(this::guardMono);
    }

    @Override
    public Mono<Boolean> expireAt(String key, Instant deadline) {
        return redisTemplate.expireAt(key, deadline).transform(this::guardMono);
    }

    @Override
    public Mono<Long> delete(String key) {
        return redisTemplate.delete(key).transform(this::guardMono);
    }

    @Override
    public Mono<Boolean> sortedSetAdd(String key, String member, double score) {
        return redisTemplate.opsForZSet()
            .add(key, member, score)
            .transform(this::guardMono);
    }

    @Override
    public Mono<ScoredMember> popMin(String key) {
        return redisTemplate.opsForZSet()
            .popMin(key)
            .map(tuple -> new ScoredMember(tuple.getValue(), tuple.getScore() == null ? 0 : tuple.getScore()))
            .transform(this::guardMono);
    }

    @Override
    public Flux<String> rangeByScore(String key, double maxScore, int limit) {
        Range<Double> range = Range.of(Range.Bound.unbounded(), Range.Bound.inclusive(maxScore));
        return redisTemplate.opsForZSet()
            .rangeByScore(key, range, Limit.limit().count(limit))
            .transform(this::guardFlux);
    }

    @Override
    public Mono<Boolean> sortedSetRemove(String key, String member) {
        return redisTemplate.opsForZSet()
            .remove(key, member)
            .map(removed -> removed > 0)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Long> sortedSetSize(String key) {
        return redisTemplate.opsForZSet()
            .size(key)
            .defaultIfEmpty(0L)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Long> listPush(String key, String value) {
        return redisTemplate.opsForList()
            .leftPush(key, value)
            .transform(this::guardMono);
    }

    @Override
    public Mono<String> listBlockingPop(String key, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return redisTemplate.opsForList().rightPop(key).transform(this::guardMono);
        }
        // BRPOP has second resolution and treats 0 as "forever"
        Duration effective = timeout.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : timeout;
        return redisTemplate.opsForList()
            .rightPop(key, effective)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Long> listSize(String key) {
        return redisTemplate.opsForList()
            .size(key)
            .defaultIfEmpty(0L)
            .transform(this::guardMono);
    }

    @Override
    public Mono<String> streamAppend(String key, Map<String, String> fields) {
        return redisTemplate.<String, String>opsForStream()
            .add(key, fields)
            .map(RecordId::getValue)
            .transform(this::guardMono);
    }

    @Override
    public Flux<StreamEntry> streamRead(String key, String afterId, int count, Duration block) {
        StreamReadOptions options = StreamReadOptions.empty().count(count).block(block);
        return redisTemplate.<String, String>opsForStream()
            .read(options, StreamOffset.create(key, ReadOffset.from(afterId)))
            .map(record -> new StreamEntry(record.getId().getValue(), record.getValue()))
            .transform(this::guardFlux);
    }

    @Override
    public Mono<Boolean> setAdd(String key, String member) {
        return redisTemplate.opsForSet()
            .add(key, member)
            .map(added -> added > 0)
            .transform(this::guardMono);
    }

    @Override
    public Mono<Boolean> setRemove(String key, String member) {
        return redisTemplate.opsForSet()
            .remove(key, member)
            .map(removed -> removed > 0)
            .transform(this::guardMono);
    }

    @Override
    public Flux<String> setMembers(String key) {
        return redisTemplate.opsForSet()
            .members(key)
            .transform(this::guardFlux);
    }

    @Override
    public Mono<Void> ping() {
        return redisTemplate.execute(connection -> connection.ping())
            .then()
            .transform(this::guardMono);
    }

    private <T> Mono<T> guardMono(Mono<T> source) {
        return source.onErrorMap(DataAccessException.class, this::unavailable);
    }

    private <T> Flux<T> guardFlux(Flux<T> source) {
        return source.onErrorMap(DataAccessException.class, this::unavailable);
    }

    private Throwable unavailable(DataAccessException e) {
        log.warn("Redis command failed: {}", e.getMessage());
        return new StoreUnavailableException("Coordination store unavailable: " + e.getMessage(), e);
    }
}

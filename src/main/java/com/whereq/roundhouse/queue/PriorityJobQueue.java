package com.whereq.roundhouse.queue;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.store.CoordinationStore;
import com.whereq.roundhouse.store.ScoredMember;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Expedited jobs, kept in a sorted set.
 *
 * Score is {@code admittedAtMillis - priority * priorityWeight}: a higher priority sorts
 * first, equal priorities sort by admission time. Jobs admitted in the same millisecond
 * share a score and fall back to member order; job ids are time-ordered, so that is
 * admission order too. Polling is a single ZPOPMIN and never blocks.
 */
@Slf4j
@Component
public class PriorityJobQueue implements JobQueue {

    private final CoordinationStore store;
    private final QueueKeys keys;
    private final long priorityWeight;

    @Autowired
    public PriorityJobQueue(CoordinationStore store, QueueKeys keys, RoundhouseProperties properties) {
        this(store, keys, properties.getQueue().getPriorityWeight());
    }

    public PriorityJobQueue(CoordinationStore store, QueueKeys keys, long priorityWeight) {
        this.store = store;
        this.keys = keys;
        this.priorityWeight = priorityWeight;
    }

    @Override
    public Mono<Void> offer(BuildJob job) {
        double score = score(job);
        return store.sortedSetAdd(keys.priorityQueue(), job.getId().toString(), score)
            .doOnSuccess(added -> log.debug("Job {} added to priority queue with score {}", job.getId(), score))
            .then();
    }

    @Override
    public Mono<UUID> poll(Duration maxWait) {
        return store.popMin(keys.priorityQueue())
            .map(ScoredMember::getMember)
            .map(UUID::fromString);
    }

    @Override
    public Mono<Long> size() {
        return store.sortedSetSize(keys.priorityQueue());
    }

    double score(BuildJob job) {
        return (double) job.getCreatedAt().toEpochMilli() - (double) job.getPriority() * priorityWeight;
    }
}

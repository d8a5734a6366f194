package com.whereq.roundhouse.queue;

import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.store.CoordinationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Normal-priority jobs in arrival order. Ids are pushed at the head and claimed from the
 * tail with a blocking pop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FifoJobQueue implements JobQueue {

    private final CoordinationStore store;
    private final QueueKeys keys;

    @Override
    public Mono<Void> offer(BuildJob job) {
        return store.listPush(keys.fifoQueue(), job.getId().toString())
            .doOnSuccess(size -> log.debug("Job {} added to FIFO queue, size: {}", job.getId(), size))
            .then();
    }

    @Override
    public Mono<UUID> poll(Duration maxWait) {
        return store.listBlockingPop(keys.fifoQueue(), maxWait)
            .map(UUID::fromString);
    }

    @Override
    public Mono<Long> size() {
        return store.listSize(keys.fifoQueue());
    }
}

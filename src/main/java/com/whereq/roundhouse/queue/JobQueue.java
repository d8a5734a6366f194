package com.whereq.roundhouse.queue;

import com.whereq.roundhouse.model.BuildJob;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * One of the two dispatch structures. Queues hold bare job ids; the job itself lives in
 * its record.
 */
public interface JobQueue {
    /**
     * Insert a reference to an admitted job
     *
     * @param job the admitted job, identity and admission time assigned
     * @return Mono that completes when the reference is stored
     */
    Mono<Void> offer(BuildJob job);

    /**
     * Atomically take the next job id. Two concurrent callers never receive the same id.
     *
     * @param maxWait how long to wait for work, ignored by queues that never block
     * @return Mono with the job id, or empty if no work arrived in time
     */
    Mono<UUID> poll(Duration maxWait);

    /**
     * Get current queue size
     *
     * @return Mono with queue size
     */
    Mono<Long> size();
}

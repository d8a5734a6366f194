package com.whereq.roundhouse.service;

import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.CoordinationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Membership set of live workers.
 *
 * Entries carry no heartbeat and never expire: a worker that dies without unregistering
 * stays listed until it is removed by hand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerRegistry {

    private final CoordinationStore store;
    private final QueueKeys keys;

    public Mono<Void> register(String workerId) {
        return store.setAdd(keys.activeWorkers(), workerId)
            .doOnSuccess(added -> log.info("Worker {} registered", workerId))
            .then();
    }

    public Mono<Void> unregister(String workerId) {
        return store.setRemove(keys.activeWorkers(), workerId)
            .doOnSuccess(removed -> log.info("Worker {} unregistered", workerId))
            .then();
    }

    /**
     * List registered worker ids, in no particular order
     */
    public Mono<List<String>> listActive() {
        return store.setMembers(keys.activeWorkers()).collectList();
    }
}

package com.whereq.roundhouse.queue;

import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.store.InMemoryCoordinationStore;
import com.whereq.roundhouse.support.MutableClock;
import com.whereq.roundhouse.support.TestJobs;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class FifoJobQueueTest {

    private final InMemoryCoordinationStore store =
        new InMemoryCoordinationStore(new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    private final FifoJobQueue queue = new FifoJobQueue(store, new QueueKeys("test"));

    @Test
    void pollsInArrivalOrder() {
        BuildJob first = job();
        BuildJob second = job();
        BuildJob third = job();
        queue.offer(first).block();
        queue.offer(second).block();
        queue.offer(third).block();

        assertThat(queue.poll(Duration.ofMillis(50)).block()).isEqualTo(first.getId());
        assertThat(queue.poll(Duration.ofMillis(50)).block()).isEqualTo(second.getId());
        assertThat(queue.poll(Duration.ofMillis(50)).block()).isEqualTo(third.getId());
    }

    @Test
    void pollOnEmptyQueueCompletesEmptyAfterWait() {
        assertThat(queue.poll(Duration.ofMillis(50)).block(Duration.ofSeconds(5))).isNull();
        assertThat(queue.size().block()).isZero();
    }

    private static BuildJob job() {
        return TestJobs.draft(0).toBuilder().id(UUID.randomUUID()).createdAt(Instant.now()).build();
    }
}

package com.whereq.roundhouse.service;

import com.whereq.roundhouse.exception.JobValidationException;
import com.whereq.roundhouse.model.LogLine;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.InMemoryCoordinationStore;
import com.whereq.roundhouse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class BuildLogStreamTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MutableClock clock;
    private InMemoryCoordinationStore store;
    private QueueKeys keys;
    private BuildLogStream logs;
    private UUID jobId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryCoordinationStore(clock);
        keys = new QueueKeys("test");
        logs = new BuildLogStream(store, keys, clock, Duration.ofDays(7), 100, Duration.ofMillis(50));
        jobId = UUID.randomUUID();
    }

    @Test
    void replaysAllLinesFromTheStart() {
        logs.append(jobId, "a").block();
        logs.append(jobId, "b").block();
        logs.append(jobId, "c").block();

        List<LogLine> lines = logs.stream(jobId, null).take(3).collectList().block(TIMEOUT);

        assertThat(lines).extracting(LogLine::getLine).containsExactly("a", "b", "c");
        assertThat(lines).extracting(LogLine::getTimestamp).containsOnly(START);
    }

    @Test
    void readerStartingMidStreamSeesOnlyLaterLines() {
        String afterA = logs.append(jobId, "a").block();
        logs.append(jobId, "b").block();
        logs.append(jobId, "c").block();

        List<String> lines = logs.stream(jobId, afterA)
            .map(LogLine::getLine)
            .take(2)
            .collectList()
            .block(TIMEOUT);

        assertThat(lines).containsExactly("b", "c");
    }

    @Test
    void malformedCursorIsRejected() {
        logs.append(jobId, "a").block();

        assertThatThrownBy(() -> logs.stream(jobId, "abc").blockFirst(TIMEOUT))
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("abc");
        assertThatThrownBy(() -> logs.stream(jobId, "1714557600000-x").blockFirst(TIMEOUT))
            .isInstanceOf(JobValidationException.class);
        assertThat(BuildLogStream.isValidCursor("1714557600000-3")).isTrue();
        assertThat(BuildLogStream.isValidCursor(BuildLogStream.FROM_START)).isTrue();
        assertThat(BuildLogStream.isValidCursor(null)).isTrue();
    }

    @Test
    void tailReceivesLinesAppendedAfterSubscribing() {
        List<String> received = new CopyOnWriteArrayList<>();
        Disposable reader = logs.stream(jobId, BuildLogStream.FROM_START)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(line -> received.add(line.getLine()));
        try {
            logs.append(jobId, "step 1/2").block();
            await().atMost(TIMEOUT).until(() -> received.size() == 1);

            logs.append(jobId, "step 2/2").block();
            await().atMost(TIMEOUT).until(() -> received.size() == 2);

            assertThat(received).containsExactly("step 1/2", "step 2/2");
        } finally {
            reader.dispose();
        }
    }

    @Test
    void independentReadersEachSeeEveryLine() {
        logs.append(jobId, "a").block();
        logs.append(jobId, "b").block();

        List<String> first = logs.stream(jobId, null).map(LogLine::getLine).take(2).collectList().block(TIMEOUT);
        List<String> second = logs.stream(jobId, null).map(LogLine::getLine).take(2).collectList().block(TIMEOUT);

        assertThat(first).containsExactly("a", "b");
        assertThat(second).containsExactly("a", "b");
    }

    @Test
    void cancelledReaderResumesFromItsLastCursorWithoutLoss() {
        List<LogLine> received = new CopyOnWriteArrayList<>();
        Disposable reader = logs.stream(jobId, null)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(received::add);

        logs.append(jobId, "a").block();
        await().atMost(TIMEOUT).until(() -> received.size() == 1);
        reader.dispose();
        assertThat(reader.isDisposed()).isTrue();

        logs.append(jobId, "b").block();
        logs.append(jobId, "c").block();

        String lastSeen = received.get(received.size() - 1).getCursor();
        List<String> resumed = logs.stream(jobId, lastSeen).map(LogLine::getLine).take(2).collectList().block(TIMEOUT);

        assertThat(received).extracting(LogLine::getLine).containsExactly("a");
        assertThat(resumed).containsExactly("b", "c");
    }

    @Test
    void everyAppendPushesRetentionOut() {
        logs.append(jobId, "a").block();
        clock.advance(Duration.ofDays(6));
        logs.append(jobId, "b").block();

        clock.advance(Duration.ofDays(6));
        assertThat(store.streamRead(keys.logs(jobId), "0", 10, Duration.ZERO).collectList().block()).hasSize(2);

        clock.advance(Duration.ofDays(1).plusSeconds(1));
        assertThat(store.streamRead(keys.logs(jobId), "0", 10, Duration.ZERO).collectList().block()).isEmpty();
    }
}

package com.whereq.roundhouse.service;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.exception.JobValidationException;
import com.whereq.roundhouse.model.LogLine;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.CoordinationStore;
import com.whereq.roundhouse.store.StreamEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Append-only build log per job, with tailing readers.
 *
 * Each job has its own stream. Every append pushes the stream's expiry out to the job
 * retention again, so a log outlives its last line by that window.
 */
@Slf4j
@Service
public class BuildLogStream {

    /**
     * Cursor that replays a stream from its first line
     */
    public static final String FROM_START = "0";

    private static final Pattern CURSOR_PATTERN = Pattern.compile("\\d+(-\\d+)?");

    static final String FIELD_LINE = "line";
    static final String FIELD_TIMESTAMP = "timestamp";

    private final CoordinationStore store;
    private final QueueKeys keys;
    private final Clock clock;
    private final Duration retention;
    private final int batchSize;
    private final Duration readBlock;

    @Autowired
    public BuildLogStream(CoordinationStore store, QueueKeys keys, Clock clock, RoundhouseProperties properties) {
        this(store, keys, clock, properties.getQueue().getJobRetention(),
            properties.getLogs().getReadBatchSize(), properties.getLogs().getReadBlock());
    }

    public BuildLogStream(CoordinationStore store, QueueKeys keys, Clock clock, Duration retention,
                          int batchSize, Duration readBlock) {
        this.store = store;
        this.keys = keys;
        this.clock = clock;
        this.retention = retention;
        this.batchSize = batchSize;
        this.readBlock = readBlock;
    }

    /**
     * Append a line to the job's log
     *
     * @param jobId job identifier
     * @param line log text
     * @return Mono with the cursor of the new line
     */
    public Mono<String> append(UUID jobId, String line) {
        String key = keys.logs(jobId);
        return store.streamAppend(key, Map.of(
                FIELD_LINE, line,
                FIELD_TIMESTAMP, clock.instant().toString()))
            .flatMap(cursor -> store.expire(key, retention).thenReturn(cursor));
    }

    /**
     * Tail a job's log.
     *
     * Replays the lines after {@code fromCursor}, then waits for new ones. The sequence
     * never completes on its own; cancel the subscription to stop reading. A reader that
     * resubscribes with the cursor of the last line it saw loses nothing.
     *
     * @param jobId job identifier
     * @param fromCursor cursor of the last line already seen, or null for the whole log
     * @return Flux of log lines; errors with {@link JobValidationException} if the cursor
     *     is malformed
     */
    public Flux<LogLine> stream(UUID jobId, String fromCursor) {
        if (!isValidCursor(fromCursor)) {
            return Flux.error(new JobValidationException("Invalid log cursor: " + fromCursor));
        }
        String key = keys.logs(jobId);

        return Flux.defer(() -> {
            AtomicReference<String> cursor = new AtomicReference<>(
                fromCursor == null || fromCursor.isBlank() ? FROM_START : fromCursor);

            return Flux.defer(() -> store.streamRead(key, cursor.get(), batchSize, readBlock))
                .doOnNext(entry -> cursor.set(entry.getId()))
                .repeat()
                .map(this::toLogLine);
        })
        .doOnCancel(() -> log.debug("Log reader for job {} cancelled", jobId));
    }

    /**
     * A cursor is absent, blank, or a stream entry id such as {@code 1714557600000-0}
     */
    public static boolean isValidCursor(String cursor) {
        return cursor == null || cursor.isBlank() || CURSOR_PATTERN.matcher(cursor).matches();
    }

    private LogLine toLogLine(StreamEntry entry) {
        Map<String, String> fields = entry.getFields();
        String timestamp = fields.get(FIELD_TIMESTAMP);
        return new LogLine(
            entry.getId(),
            timestamp == null ? null : Instant.parse(timestamp),
            fields.getOrDefault(FIELD_LINE, ""));
    }
}

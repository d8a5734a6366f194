package com.whereq.roundhouse.model;

import lombok.Value;

import java.time.Instant;

/**
 * One appended build log line. {@code cursor} is the stream position; resuming a tail
 * from it yields the lines after this one.
 */
@Value
public class LogLine {
    String cursor;
    Instant timestamp;
    String line;
}

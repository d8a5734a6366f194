package com.whereq.roundhouse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A stored job together with its current lifecycle fields
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobRecord {
    BuildJob job;

    JobStatus status;

    /**
     * Worker that claimed the job, null while queued
     */
    String workerId;

    Instant createdAt;

    Instant startedAt;

    Instant completedAt;
}

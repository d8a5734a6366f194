package com.whereq.roundhouse.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.BuildResult;
import com.whereq.roundhouse.model.JobRecord;
import com.whereq.roundhouse.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job with its current status and, once the build ended, its result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobDetailsResponse {

    private BuildJob job;

    private JobStatus status;

    private String workerId;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Null until the build ended. May appear shortly before the terminal status.
     */
    private BuildResult result;

    public static JobDetailsResponse of(JobRecord record, BuildResult result) {
        return JobDetailsResponse.builder()
            .job(record.getJob())
            .status(record.getStatus())
            .workerId(record.getWorkerId())
            .createdAt(record.getCreatedAt())
            .startedAt(record.getStartedAt())
            .completedAt(record.getCompletedAt())
            .result(result)
            .build();
    }
}

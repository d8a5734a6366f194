package com.whereq.roundhouse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.roundhouse.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Response for job cancellation and retry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobActionResponse {
    /**
     * Job the action was requested for
     */
    private UUID jobId;

    /**
     * Job created by a retry
     */
    private UUID newJobId;

    private JobStatus status;

    private String message;

    public static JobActionResponse error(UUID jobId, String message) {
        return JobActionResponse.builder()
            .jobId(jobId)
            .message(message)
            .build();
    }
}

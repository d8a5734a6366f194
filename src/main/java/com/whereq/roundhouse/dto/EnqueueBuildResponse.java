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
 * Response for build admission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnqueueBuildResponse {
    /**
     * Unique job identifier
     */
    private UUID jobId;

    private JobStatus status;

    /**
     * Jobs waiting in both queues right after admission
     */
    private Long position;

    /**
     * Error message (if admission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static EnqueueBuildResponse error(String message) {
        return EnqueueBuildResponse.builder()
            .errorMessage(message)
            .build();
    }
}

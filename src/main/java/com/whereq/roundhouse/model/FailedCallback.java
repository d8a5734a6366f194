package com.whereq.roundhouse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A completion callback waiting to be delivered again
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FailedCallback {
    /**
     * Attempt identifier, assigned when the retry is scheduled
     */
    private UUID id;

    private UUID jobId;

    private String callbackUrl;

    /**
     * Result to deliver
     */
    private BuildResult payload;

    /**
     * Delivery attempts made so far
     */
    private int attempts;

    /**
     * When the next delivery is due
     */
    private Instant nextRetry;

    private Instant createdAt;

    /**
     * Last delivery failure, for operators
     */
    private String lastError;
}

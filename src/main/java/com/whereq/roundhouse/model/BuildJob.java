package com.whereq.roundhouse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A build job as stored in the queue.
 *
 * Identity and admission time are assigned by admission, never by the caller. A job is
 * immutable once admitted; re-admission produces a new job.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildJob {
    /**
     * Unique job identifier
     */
    UUID id;

    UUID releaseId;

    UUID serviceId;

    UUID projectId;

    /**
     * Source repository URL
     */
    String gitRepo;

    String gitSha;

    String gitBranch;

    /**
     * How to build the image; opaque to the queue
     */
    BuildConfig buildConfig;

    /**
     * Where to deliver the build result, may be empty
     */
    String callbackUrl;

    /**
     * When the job was admitted
     */
    Instant createdAt;

    /**
     * 0 for FIFO dispatch, higher values are dispatched first
     */
    int priority;

    /**
     * Abbreviated commit for log output
     */
    public String shortSha() {
        return gitSha == null || gitSha.length() <= 8 ? gitSha : gitSha.substring(0, 8);
    }

    public boolean hasCallback() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }
}

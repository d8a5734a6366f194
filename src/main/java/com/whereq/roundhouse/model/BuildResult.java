package com.whereq.roundhouse.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of a build, written once by the worker that executed the job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildResult {
    private UUID jobId;

    private UUID releaseId;

    private boolean success;

    /**
     * Pushed image reference
     */
    private String imageUri;

    private String imageDigest;

    private double imageSizeMb;

    /**
     * Software bill of materials
     */
    private String sbom;

    private String sbomFormat;

    /**
     * Detached image signature
     */
    private String imageSignature;

    private double durationSecs;

    /**
     * Error message if failed
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String errorMessage;

    private String logsUrl;

    public static BuildResult failure(BuildJob job, String errorMessage, double durationSecs) {
        return BuildResult.builder()
            .jobId(job.getId())
            .releaseId(job.getReleaseId())
            .success(false)
            .errorMessage(errorMessage)
            .durationSecs(durationSecs)
            .build();
    }
}

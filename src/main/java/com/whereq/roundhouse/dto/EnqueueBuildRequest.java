package com.whereq.roundhouse.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whereq.roundhouse.model.BuildConfig;
import com.whereq.roundhouse.model.BuildJob;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Normalized build request, as sent by the orchestrator after a source change.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnqueueBuildRequest {

    @NotNull
    private UUID releaseId;

    @NotNull
    private UUID serviceId;

    @NotNull
    private UUID projectId;

    /**
     * Repository to clone, e.g. https://github.com/acme/api.git
     */
    @NotBlank
    private String gitRepo;

    /**
     * Commit to build
     */
    @NotBlank
    private String gitSha;

    private String gitBranch;

    @NotNull
    private BuildConfig buildConfig;

    /**
     * Where the build result is POSTed when the build ends. Optional.
     */
    private String callbackUrl;

    /**
     * 0 (default) queues behind earlier jobs; higher values are dispatched first.
     */
    @Min(0)
    private int priority;

    public BuildJob toJob() {
        return BuildJob.builder()
            .releaseId(releaseId)
            .serviceId(serviceId)
            .projectId(projectId)
            .gitRepo(gitRepo)
            .gitSha(gitSha)
            .gitBranch(gitBranch)
            .buildConfig(buildConfig)
            .callbackUrl(callbackUrl)
            .priority(priority)
            .build();
    }
}

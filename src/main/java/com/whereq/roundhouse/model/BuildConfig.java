package com.whereq.roundhouse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Specifies how to build the image. The queue stores it and hands it to the executor
 * without interpreting it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BuildConfig {
    /**
     * Build strategy: dockerfile, buildpack or auto
     */
    private String type;

    /**
     * Path to the Dockerfile
     */
    private String dockerfile;

    /**
     * Buildpack URL
     */
    private String buildpack;

    /**
     * Build context path
     */
    private String context;

    private Map<String, String> buildArgs;

    /**
     * Multi-stage target
     */
    private String target;
}

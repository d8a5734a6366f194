package com.whereq.roundhouse.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception thrown when a job identity is unknown, either never admitted or past its
 * retention window
 */
@Getter
public class JobNotFoundException extends DispatchException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}

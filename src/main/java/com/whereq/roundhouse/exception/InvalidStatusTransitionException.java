package com.whereq.roundhouse.exception;

import com.whereq.roundhouse.model.JobStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Exception thrown when a status update would move a job backwards
 */
@Getter
public class InvalidStatusTransitionException extends DispatchException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidStatusTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}

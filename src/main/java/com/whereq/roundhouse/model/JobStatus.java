package com.whereq.roundhouse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Build job lifecycle states
 *
 * State transitions:
 * QUEUED → BUILDING → {COMPLETED, FAILED, CANCELLED}
 * QUEUED → CANCELLED
 * A status never moves backwards.
 */
public enum JobStatus {
    /**
     * Admitted, waiting for a worker
     */
    QUEUED("queued", 0),

    /**
     * Claimed by a worker
     */
    BUILDING("building", 1),

    /**
     * Build succeeded
     */
    COMPLETED("completed", 2),

    /**
     * Build failed
     */
    FAILED("failed", 2),

    /**
     * Cancelled by an operator
     */
    CANCELLED("cancelled", 2);

    private final String value;
    private final int rank;

    JobStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /**
     * Wire and storage representation
     */
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return rank == 2;
    }

    /**
     * Re-asserting the current status is allowed, moving to an earlier stage or between
     * terminal states is not.
     */
    public boolean canTransitionTo(JobStatus next) {
        return next == this || next.rank > rank;
    }
}

package com.whereq.roundhouse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time queue depths for monitoring
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueueStats {
    long priorityDepth;

    long fifoDepth;

    long pendingCallbacks;

    int activeWorkers;

    public long getTotalDepth() {
        return priorityDepth + fifoDepth;
    }
}

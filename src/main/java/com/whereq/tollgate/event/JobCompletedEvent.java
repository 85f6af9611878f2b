package com.whereq.tollgate.event;

import com.whereq.tollgate.model.JobResult;
import lombok.Value;

import java.time.Instant;

/**
 * Published when a worker reports success
 */
@Value
public class JobCompletedEvent {
    String jobId;
    JobResult result;
    long executionTimeMs;

    /**
     * Amount charged, always the admission-time estimate
     */
    double cost;

    Instant occurredAt;
}

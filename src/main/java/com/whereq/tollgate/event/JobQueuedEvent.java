package com.whereq.tollgate.event;

import lombok.Value;

import java.time.Instant;

/**
 * Published when a job is admitted into the queue
 */
@Value
public class JobQueuedEvent {
    String jobId;
    int queueSize;
    Instant occurredAt;
}

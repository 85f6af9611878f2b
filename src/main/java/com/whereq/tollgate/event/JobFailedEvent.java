package com.whereq.tollgate.event;

import lombok.Value;

import java.time.Instant;

/**
 * Published when an active job fails. The job is not retried.
 */
@Value
public class JobFailedEvent {
    String jobId;
    String error;
    int attempts;
    Instant occurredAt;
}

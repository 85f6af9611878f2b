package com.whereq.tollgate.event;

import lombok.Value;

import java.time.Instant;

@Value
public class ShutdownCompleteEvent {
    /**
     * Jobs still active when the grace period ran out
     */
    int abandonedActiveJobs;

    Instant occurredAt;
}

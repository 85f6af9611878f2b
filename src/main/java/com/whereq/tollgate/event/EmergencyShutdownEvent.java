package com.whereq.tollgate.event;

import lombok.Value;

import java.time.Instant;

@Value
public class EmergencyShutdownEvent {
    String reason;

    /**
     * Queued jobs discarded by the emergency stop
     */
    int discardedJobs;

    Instant occurredAt;
}

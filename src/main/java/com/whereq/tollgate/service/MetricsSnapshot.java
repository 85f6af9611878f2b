package com.whereq.tollgate.service;

import lombok.Builder;
import lombok.Value;

/**
 * Throughput and latency counters at a point in time
 */
@Value
@Builder
public class MetricsSnapshot {
    long totalJobsReceived;
    long totalJobsCompleted;
    long totalJobsFailed;
    long totalJobsRejected;
    double totalSpend;

    /**
     * Completions per second over the last aggregation window
     */
    double currentThroughput;

    /**
     * Exponentially weighted moving average of execution time
     */
    double averageResponseTimeMs;
}

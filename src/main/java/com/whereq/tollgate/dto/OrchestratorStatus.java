package com.whereq.tollgate.dto;

import com.whereq.tollgate.budget.CostSnapshot;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.service.MetricsSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of the orchestrator, cheap enough to poll
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorStatus {

    private OrchestratorState state;

    private int activeJobs;

    private int queuedJobs;

    /**
     * Workers known to the pool
     */
    private int totalAgents;

    private MetricsSnapshot metrics;

    private CostSnapshot costTracker;

    private RateLimiterInfo rateLimiter;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimiterInfo {
        private int tokensAvailable;
        private int requestsPerMinute;
    }
}

package com.whereq.tollgate.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background loops driving the orchestrator.
 *
 * Refill and drain run every second; spend windows and throughput are checked every minute.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrchestratorScheduler {

    private final JobOrchestrator orchestrator;

    @Scheduled(fixedRateString = "${tollgate.scheduler.refill-check-interval-ms:1000}")
    public void refillRateLimiter() {
        orchestrator.refillRateLimiter();
    }

    @Scheduled(fixedRateString = "${tollgate.scheduler.cost-tick-interval-ms:60000}")
    public void tickCostWindows() {
        orchestrator.tickCostWindows();
    }

    @Scheduled(fixedDelayString = "${tollgate.scheduler.drain-interval-ms:1000}")
    public void drain() {
        try {
            orchestrator.drainOnce();
        } catch (RuntimeException e) {
            log.error("Drain tick failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString = "${tollgate.scheduler.metrics-interval-ms:60000}")
    public void aggregateMetrics() {
        orchestrator.aggregateMetrics();
    }
}

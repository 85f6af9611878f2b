package com.whereq.tollgate.service;

import com.whereq.tollgate.event.CostAlertEvent;
import com.whereq.tollgate.event.EmergencyShutdownEvent;
import com.whereq.tollgate.event.JobCompletedEvent;
import com.whereq.tollgate.event.JobFailedEvent;
import com.whereq.tollgate.event.ShutdownCompleteEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes orchestrator events to the audit log
 */
@Slf4j(topic = "tollgate.events")
@Component
public class OrchestratorEventLogger {

    @EventListener
    public void onJobCompleted(JobCompletedEvent event) {
        log.info("job_completed jobId={} executionTimeMs={} cost={}",
            event.getJobId(), event.getExecutionTimeMs(), event.getCost());
    }

    @EventListener
    public void onJobFailed(JobFailedEvent event) {
        log.warn("job_failed jobId={} attempts={} error={}",
            event.getJobId(), event.getAttempts(), event.getError());
    }

    @EventListener
    public void onCostAlert(CostAlertEvent event) {
        log.warn("cost_alert level={} percentage={}", event.getLevel(), String.format("%.1f", event.getPercentage()));
    }

    @EventListener
    public void onEmergencyShutdown(EmergencyShutdownEvent event) {
        log.error("emergency_shutdown reason={} discardedJobs={}", event.getReason(), event.getDiscardedJobs());
    }

    @EventListener
    public void onShutdownComplete(ShutdownCompleteEvent event) {
        log.info("shutdown_complete abandonedActiveJobs={}", event.getAbandonedActiveJobs());
    }
}

package com.whereq.tollgate.service;

import com.whereq.tollgate.budget.CostTracker;
import com.whereq.tollgate.exception.AdmissionRejectedException;
import com.whereq.tollgate.exception.AdmissionRejectedException.Reason;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.queue.JobQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Admission control for job submissions.
 * Decides whether to queue or reject a job; rejection never leaves state behind.
 */
@Slf4j
public class AdmissionController {

    private final int maxQueueSize;
    private final CostTracker costTracker;
    private final JobQueue jobQueue;
    private final OrchestratorMetrics metrics;

    public AdmissionController(int maxQueueSize, CostTracker costTracker, JobQueue jobQueue,
                               OrchestratorMetrics metrics) {
        this.maxQueueSize = maxQueueSize;
        this.costTracker = costTracker;
        this.jobQueue = jobQueue;
        this.metrics = metrics;
    }

    /**
     * Reject unless the orchestrator is running
     */
    public void checkAccepting(OrchestratorState state) {
        if (state.acceptsJobs()) {
            return;
        }
        reject(state.isShuttingDownOrStopped() ? Reason.SHUTTING_DOWN : Reason.NOT_INITIALIZED, null);
    }

    /**
     * Reject once either spend ceiling is reached. Runs before any pricing work.
     */
    public void checkBudget() {
        if (costTracker.isDailyLimitReached()) {
            reject(Reason.DAILY_SPEND_LIMIT, null);
        }
        if (costTracker.isHourlyLimitReached()) {
            reject(Reason.HOURLY_SPEND_LIMIT, null);
        }
    }

    /**
     * Queue a priced job
     *
     * @param job the job
     * @return 1-based queue position
     */
    public int enqueue(Job job) {
        return jobQueue.offer(job, maxQueueSize)
            .orElseGet(() -> {
                reject(Reason.QUEUE_FULL, job);
                return 0;
            });
    }

    private void reject(Reason reason, Job job) {
        metrics.jobRejected(reason);
        if (job != null) {
            log.warn("Job {} rejected: {} (size >= {})", job.getId(), reason.getMessage(), maxQueueSize);
        } else {
            log.warn("Submission rejected: {}", reason.getMessage());
        }
        throw new AdmissionRejectedException(reason);
    }
}

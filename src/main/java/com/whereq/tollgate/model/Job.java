package com.whereq.tollgate.model;

import com.whereq.tollgate.dto.JobRequest;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * An admitted job.
 *
 * <p>Pricing fields are fixed at admission: {@code estimatedCost} is the amount charged
 * against the budget when the execution attempt finishes, whatever the worker actually consumed.
 * Lifecycle fields are written by the drain tick and by the executing thread, hence synchronized.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Job {
    /**
     * Unique job identifier
     */
    private final String id;

    /**
     * Original caller request
     */
    private final JobRequest request;

    private final JobPriority priority;

    private final Complexity complexity;

    /**
     * Model tier chosen at admission
     */
    private final String selectedModel;

    /**
     * Predicted resource consumption (tokens) for the selected model
     */
    private final long estimatedUnits;

    /**
     * Predicted dollar cost for the selected model
     */
    private final double estimatedCost;

    /**
     * Maximum time the job may occupy a worker
     */
    private final long timeoutMs;

    private final Instant submittedAt;

    /**
     * Arrival sequence, FIFO tie-break within a priority
     */
    private final long sequence;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private JobState state = JobState.QUEUED;

    @Getter(AccessLevel.NONE)
    private Instant startedAt;

    @Getter(AccessLevel.NONE)
    private Instant completedAt;

    @Getter(AccessLevel.NONE)
    private int attempts;

    @Getter(AccessLevel.NONE)
    private String errorMessage;

    public synchronized JobState getState() {
        return state;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public String getAgentType() {
        return request != null ? request.getAgentType() : null;
    }

    public synchronized void markActive(Instant now) {
        requireState(JobState.QUEUED, JobState.ACTIVE);
        this.state = JobState.ACTIVE;
        this.startedAt = now;
        this.attempts++;
    }

    public synchronized void markCompleted(Instant now) {
        requireState(JobState.ACTIVE, JobState.COMPLETED);
        this.state = JobState.COMPLETED;
        this.completedAt = now;
    }

    public synchronized void markFailed(Instant now, String errorMessage) {
        requireState(JobState.ACTIVE, JobState.FAILED);
        this.state = JobState.FAILED;
        this.completedAt = now;
        this.errorMessage = errorMessage;
    }

    private void requireState(JobState expected, JobState target) {
        if (state != expected) {
            throw new IllegalStateException(
                "Job " + id + " cannot move from " + state + " to " + target);
        }
    }
}

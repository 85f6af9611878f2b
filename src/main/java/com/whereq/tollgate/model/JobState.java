package com.whereq.tollgate.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → ACTIVE → {COMPLETED, FAILED}
 *
 * The graph is acyclic: a failed job is never re-queued, a retry is a new submission.
 */
public enum JobState {
    /**
     * Admitted, waiting in the priority queue
     */
    QUEUED,

    /**
     * Dispatched to a worker
     */
    ACTIVE,

    /**
     * Worker reported success
     */
    COMPLETED,

    /**
     * Worker reported failure or timed out
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

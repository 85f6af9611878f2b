package com.whereq.tollgate.model;

/**
 * Orchestrator lifecycle.
 *
 * UNINITIALIZED → INITIALIZING → RUNNING → SHUTTING_DOWN → STOPPED
 */
public enum OrchestratorState {
    UNINITIALIZED,
    INITIALIZING,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED;

    public boolean acceptsJobs() {
        return this == RUNNING;
    }

    public boolean isShuttingDownOrStopped() {
        return this == SHUTTING_DOWN || this == STOPPED;
    }
}

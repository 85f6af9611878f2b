package com.whereq.tollgate.worker;

import java.util.Optional;

/**
 * Supplier of workers. Only the orchestrator leases and returns workers.
 */
public interface WorkerPool {

    void initialize() throws Exception;

    /**
     * Lease an idle worker for the given model tier
     *
     * @param model model tier
     * @return a worker, or empty if none is idle right now
     */
    Optional<Worker> getAvailableWorker(String model);

    /**
     * Return a leased worker to the pool
     */
    void releaseWorker(Worker worker);

    int getTotalWorkers();

    void shutdown();
}

package com.whereq.tollgate.worker;

import com.whereq.tollgate.exception.WorkerExecutionException;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobResult;

/**
 * A worker leased from the pool
 */
public interface Worker {

    String getId();

    /**
     * Model tier this worker runs
     */
    String getModel();

    /**
     * Execute a job synchronously (blocking), honouring the job's timeout
     *
     * @param job the job
     * @return job result
     * @throws WorkerExecutionException if execution fails or times out
     */
    JobResult executeJob(Job job) throws WorkerExecutionException;
}

package com.whereq.tollgate.worker;

import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobResult;

/**
 * Runs a job's actual work on behalf of a local worker
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @param job the job to run
     * @param model model tier the job was priced for
     * @return result
     * @throws Exception if the work fails
     */
    JobResult handle(Job job, String model) throws Exception;
}

package com.whereq.tollgate.worker;

import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Handler used when the application registers none: accepts every job without doing any work
 */
@Slf4j
public class DryRunJobHandler implements JobHandler {

    @Override
    public JobResult handle(Job job, String model) {
        log.info("Dry run of job {} ({}/{}) on {}",
            job.getId(), job.getAgentType(), job.getRequest().getAction(), model);
        return JobResult.builder()
            .jobId(job.getId())
            .output("dry-run")
            .unitsUsed(0)
            .completedAt(Instant.now())
            .build();
    }
}

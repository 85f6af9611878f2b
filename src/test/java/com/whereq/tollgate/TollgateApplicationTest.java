package com.whereq.tollgate;

import com.whereq.tollgate.dto.JobSubmitResponse;
import com.whereq.tollgate.model.JobPriority;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.service.JobOrchestrator;
import com.whereq.tollgate.service.OrchestratorEventLogger;
import com.whereq.tollgate.worker.WorkerPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.autoconfigure.endpoint.web.WebEndpointProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import reactor.core.scheduler.Scheduler;

import static com.whereq.tollgate.support.TestJobs.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Boots the full application with the dry-run handler and lets the scheduled drain run a job.
 */
@SpringBootTest(properties = {
    "tollgate.scheduler.drain-interval-ms=50",
    "tollgate.shutdown.grace-period=2s"
})
class TollgateApplicationTest {

    @Autowired JobOrchestrator orchestrator;
    @Autowired WorkerPool workerPool;
    @Autowired @Qualifier("jobScheduler") Scheduler jobScheduler;
    @Autowired WebEndpointProperties webEndpoints;
    @SpyBean OrchestratorEventLogger eventLogger;

    @Test
    void contextLoads_orchestratorRunningWithOneWorkerPerTier() {
        assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.RUNNING);
        assertThat(workerPool.getTotalWorkers()).isEqualTo(3);
    }

    @Test
    void submittedJob_isDrainedAndReported() {
        JobSubmitResponse response = orchestrator.submitJob(request(JobPriority.HIGH));

        assertThat(response.getEstimatedCost()).isPositive();

        verify(eventLogger, timeout(5000)).onJobCompleted(any());
        assertThat(orchestrator.getStatus().getCostTracker().getTotalSpend()).isPositive();
    }

    @Test
    void contextLoads_exposesOnlyEndpointsBackedByTheClasspath() {
        assertThat(webEndpoints.getExposure().getInclude())
            .containsExactlyInAnyOrder("health", "info", "metrics");
        assertThat(jobScheduler.isDisposed()).isFalse();
    }
}

package com.whereq.tollgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tollgate.pricing.CostModel;
import com.whereq.tollgate.pricing.HeuristicCostModel;
import com.whereq.tollgate.worker.DryRunJobHandler;
import com.whereq.tollgate.worker.JobHandler;
import com.whereq.tollgate.worker.LocalWorkerPool;
import com.whereq.tollgate.worker.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashSet;

/**
 * Wiring for the orchestrator's collaborators.
 *
 * Applications replace the cost model, the worker pool or the job handler by declaring
 * their own bean of that type.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(TollgateProperties.class)
public class TollgateConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Threads that run dispatched jobs, so a slow worker never holds up the drain tick
     */
    @Bean(name = "jobScheduler", destroyMethod = "dispose")
    public Scheduler jobScheduler(TollgateProperties properties) {
        return Schedulers.newBoundedElastic(properties.getWorkers().getExecutorThreads(),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "tollgate-job", 60, true);
    }

    @Bean
    @ConditionalOnMissingBean
    public CostModel costModel(ObjectMapper objectMapper, TollgateProperties properties) {
        return new HeuristicCostModel(objectMapper, properties.getModelSelection());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandler jobHandler() {
        log.warn("No JobHandler bean registered, local workers will dry-run every job");
        return new DryRunJobHandler();
    }

    // the orchestrator owns the pool's lifecycle
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public WorkerPool workerPool(TollgateProperties properties, JobHandler jobHandler) {
        return new LocalWorkerPool(
            new LinkedHashSet<>(properties.getModelSelection().getModels().values()),
            properties.getWorkers().getPerTier(),
            jobHandler);
    }
}

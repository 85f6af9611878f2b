package com.whereq.tollgate.service;

import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.model.Complexity;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobPriority;
import com.whereq.tollgate.pricing.CostModel;
import com.whereq.tollgate.pricing.ModelSelector;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a raw request into a priced, admission-ready job
 */
@Slf4j
public class JobEnhancer {

    private final CostModel costModel;
    private final ModelSelector modelSelector;
    private final TollgateProperties.QueueConfig queueConfig;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public JobEnhancer(CostModel costModel, ModelSelector modelSelector,
                       TollgateProperties.QueueConfig queueConfig, Clock clock) {
        this.costModel = costModel;
        this.modelSelector = modelSelector;
        this.queueConfig = queueConfig;
        this.clock = clock;
    }

    /**
     * @param request caller request
     * @param hourlySpendRatio current hourly spend over the hourly limit
     * @return a QUEUED job with identity, tier, estimates and timeout
     * @throws IllegalStateException if the cost model yields a negative or non-finite estimate
     */
    public Job enhance(JobRequest request, double hourlySpendRatio) {
        JobPriority priority = JobPriority.orDefault(request.getPriority());
        Complexity complexity = costModel.classify(request);
        String model = modelSelector.select(complexity, hourlySpendRatio);
        long units = costModel.estimateUnits(request);
        double cost = costModel.predictCost(units, model);
        if (units < 0 || !Double.isFinite(cost) || cost < 0) {
            throw new IllegalStateException("Cost model returned an invalid estimate for " + model
                + ": " + units + " units, $" + cost);
        }

        Job job = Job.builder()
            .id(generateJobId())
            .request(request)
            .priority(priority)
            .complexity(complexity)
            .selectedModel(model)
            .estimatedUnits(units)
            .estimatedCost(cost)
            .timeoutMs(queueConfig.timeoutFor(priority))
            .submittedAt(clock.instant())
            .sequence(sequence.incrementAndGet())
            .build();

        log.debug("Priced job {}: {} {} on {}, {} units, ${}",
            job.getId(), priority, complexity, model, units, cost);
        return job;
    }

    /**
     * Generate unique job ID
     */
    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}

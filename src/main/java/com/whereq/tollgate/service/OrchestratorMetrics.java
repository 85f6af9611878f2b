package com.whereq.tollgate.service;

import com.whereq.tollgate.exception.AdmissionRejectedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Job counters, latency and throughput, mirrored into Micrometer
 */
@Slf4j
public class OrchestratorMetrics {

    /**
     * Weight kept by the running average on each new sample
     */
    static final double RESPONSE_TIME_DECAY = 0.9;

    private final MeterRegistry meterRegistry;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private final Counter receivedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Timer executionTimer;

    private double averageResponseTimeMs;
    private double currentThroughput;
    private long completedAtLastAggregation;
    private long lastAggregationMillis;

    public OrchestratorMetrics(MeterRegistry meterRegistry, long nowMillis) {
        this.meterRegistry = meterRegistry;
        this.lastAggregationMillis = nowMillis;

        receivedCounter = Counter.builder("tollgate.jobs.received")
            .description("Number of jobs admitted into the queue")
            .register(meterRegistry);

        completedCounter = Counter.builder("tollgate.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failedCounter = Counter.builder("tollgate.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        executionTimer = Timer.builder("tollgate.jobs.execution.time")
            .description("Job execution time on a worker")
            .register(meterRegistry);
    }

    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
            .description(description)
            .register(meterRegistry);
    }

    public void jobReceived() {
        received.incrementAndGet();
        receivedCounter.increment();
    }

    public void jobRejected(AdmissionRejectedException.Reason reason) {
        rejected.incrementAndGet();
        Counter.builder("tollgate.admission.rejected")
            .description("Number of submissions rejected at admission")
            .tag("reason", reason.name())
            .register(meterRegistry)
            .increment();
    }

    public synchronized void jobCompleted(long executionTimeMs) {
        completed.incrementAndGet();
        completedCounter.increment();
        executionTimer.record(Duration.ofMillis(executionTimeMs));
        averageResponseTimeMs = averageResponseTimeMs * RESPONSE_TIME_DECAY
            + executionTimeMs * (1 - RESPONSE_TIME_DECAY);
    }

    public void jobFailed() {
        failed.incrementAndGet();
        failedCounter.increment();
    }

    /**
     * Recompute throughput from completions since the previous aggregation
     */
    public synchronized void aggregate(long nowMillis) {
        long elapsedMillis = nowMillis - lastAggregationMillis;
        if (elapsedMillis <= 0) {
            return;
        }
        long completedNow = completed.get();
        currentThroughput = (completedNow - completedAtLastAggregation) / (elapsedMillis / 1000.0);
        completedAtLastAggregation = completedNow;
        lastAggregationMillis = nowMillis;
        log.debug("Throughput over last {}ms: {} jobs/s, average response time {}ms",
            elapsedMillis, currentThroughput, Math.round(averageResponseTimeMs));
    }

    public synchronized MetricsSnapshot snapshot(double totalSpend) {
        return MetricsSnapshot.builder()
            .totalJobsReceived(received.get())
            .totalJobsCompleted(completed.get())
            .totalJobsFailed(failed.get())
            .totalJobsRejected(rejected.get())
            .totalSpend(totalSpend)
            .currentThroughput(currentThroughput)
            .averageResponseTimeMs(averageResponseTimeMs)
            .build();
    }
}

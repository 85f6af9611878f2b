package com.whereq.tollgate.service;

import com.whereq.tollgate.budget.CostAlert;
import com.whereq.tollgate.budget.CostTracker;
import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.dto.JobSubmitResponse;
import com.whereq.tollgate.dto.OrchestratorStatus;
import com.whereq.tollgate.event.CostAlertEvent;
import com.whereq.tollgate.event.EmergencyShutdownEvent;
import com.whereq.tollgate.event.JobCompletedEvent;
import com.whereq.tollgate.event.JobFailedEvent;
import com.whereq.tollgate.event.JobQueuedEvent;
import com.whereq.tollgate.event.ShutdownCompleteEvent;
import com.whereq.tollgate.exception.WorkerExecutionException;
import com.whereq.tollgate.model.CostAlertLevel;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobResult;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.pricing.CostModel;
import com.whereq.tollgate.pricing.ModelSelector;
import com.whereq.tollgate.queue.JobQueue;
import com.whereq.tollgate.queue.PriorityJobQueue;
import com.whereq.tollgate.ratelimit.TokenBucketRateLimiter;
import com.whereq.tollgate.worker.Worker;
import com.whereq.tollgate.worker.WorkerPool;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Budget-constrained job orchestrator.
 *
 * <pre>
 *  submitJob → price (JobEnhancer) → admission checks → priority queue
 *  drain tick → canProcessJob → lease worker → take rate limit token → execute (timeout) → charge → event
 * </pre>
 *
 * <p>The queue, the active job map, the cost tracker and the rate limiter are owned by this
 * instance and mutated only from submission, the drain tick, job completion and the
 * background ticks driven by {@link OrchestratorScheduler}. Each of them guards its own state.
 * Drain ticks are serialized, so the concurrency ceiling check and the insert into the
 * active map cannot interleave.
 */
@Slf4j
@Service
public class JobOrchestrator {

    private final TollgateProperties properties;
    private final WorkerPool workerPool;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final Scheduler jobScheduler;
    private final Clock clock;

    private final CostTracker costTracker;
    private final TokenBucketRateLimiter rateLimiter;
    private final JobQueue jobQueue;
    private final JobEnhancer jobEnhancer;
    private final AdmissionController admissionController;
    private final OrchestratorMetrics metrics;

    private final AtomicReference<OrchestratorState> state =
        new AtomicReference<>(OrchestratorState.UNINITIALIZED);
    private final Map<String, Job> activeJobs = new ConcurrentHashMap<>();
    private final ReentrantLock activeLock = new ReentrantLock();
    private final Condition activeDrained = activeLock.newCondition();
    private final Object drainLock = new Object();
    private final AtomicBoolean emergencyTriggered = new AtomicBoolean();
    private final AtomicBoolean shutdownStarted = new AtomicBoolean();

    public JobOrchestrator(TollgateProperties properties,
                           WorkerPool workerPool,
                           CostModel costModel,
                           ApplicationEventPublisher eventPublisher,
                           TaskScheduler taskScheduler,
                           @Qualifier("jobScheduler") Scheduler jobScheduler,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.properties = properties;
        this.workerPool = workerPool;
        this.eventPublisher = eventPublisher;
        this.taskScheduler = taskScheduler;
        this.jobScheduler = jobScheduler;
        this.clock = clock;

        this.costTracker = new CostTracker(properties.getCostControls(), clock);
        this.rateLimiter = new TokenBucketRateLimiter(properties.getRateLimiting().getRequestsPerMinute(), clock);
        this.jobQueue = new PriorityJobQueue();
        this.metrics = new OrchestratorMetrics(meterRegistry, clock.millis());
        this.jobEnhancer = new JobEnhancer(costModel, new ModelSelector(properties.getModelSelection()),
            properties.getQueue(), clock);
        this.admissionController = new AdmissionController(properties.getQueue().getMaxSize(),
            costTracker, jobQueue, metrics);

        metrics.registerGauge("tollgate.queue.size", "Jobs waiting in the queue", jobQueue::size);
        metrics.registerGauge("tollgate.jobs.active", "Jobs executing on workers", activeJobs::size);
        metrics.registerGauge("tollgate.spend.hourly", "Spend in the current hourly window", costTracker::getHourlySpend);
        metrics.registerGauge("tollgate.spend.daily", "Spend in the current daily window", costTracker::getDailySpend);
        metrics.registerGauge("tollgate.ratelimit.tokens", "Rate limiter tokens left in this window",
            rateLimiter::availableTokens);
    }

    /**
     * Initialize the worker pool and start accepting jobs
     */
    @PostConstruct
    public void initialize() {
        if (!state.compareAndSet(OrchestratorState.UNINITIALIZED, OrchestratorState.INITIALIZING)) {
            log.warn("Initialize ignored, orchestrator is {}", state.get());
            return;
        }
        log.info("Initializing job orchestrator...");
        try {
            workerPool.initialize();
        } catch (Exception e) {
            state.set(OrchestratorState.UNINITIALIZED);
            log.error("Orchestrator initialization failed", e);
            throw new IllegalStateException("Worker pool initialization failed: " + e.getMessage(), e);
        }
        state.set(OrchestratorState.RUNNING);
        log.info("Job orchestrator running: {} max concurrent jobs, queue max {}, {} requests/min, "
                + "hourly limit ${}, daily limit ${}",
            properties.getAgents().getMaxConcurrent(),
            properties.getQueue().getMaxSize(),
            rateLimiter.getRequestsPerMinute(),
            properties.getCostControls().getHourlySpendLimit(),
            properties.getCostControls().getDailySpendLimit());
    }

    /**
     * Price, check and queue a job
     *
     * @param request job request
     * @return admission details
     * @throws com.whereq.tollgate.exception.AdmissionRejectedException if the job is not admitted
     */
    public JobSubmitResponse submitJob(JobRequest request) {
        Objects.requireNonNull(request, "request");

        admissionController.checkAccepting(state.get());
        admissionController.checkBudget();

        Job job = jobEnhancer.enhance(request, costTracker.hourlyRatio());
        int position = admissionController.enqueue(job);

        metrics.jobReceived();
        int queueSize = jobQueue.size();
        log.info("Job {} queued at position {} ({} on {}, estimated ${}), queue size: {}",
            job.getId(), position, job.getPriority(), job.getSelectedModel(), job.getEstimatedCost(), queueSize);
        publish(new JobQueuedEvent(job.getId(), queueSize, clock.instant()));

        return JobSubmitResponse.builder()
            .jobId(job.getId())
            .queuePosition(position)
            .estimatedCost(job.getEstimatedCost())
            .selectedModel(job.getSelectedModel())
            .submittedAt(job.getSubmittedAt())
            .build();
    }

    /**
     * True only if concurrency, hourly budget and rate limit all allow another execution
     */
    public boolean canProcessJob() {
        return activeJobs.size() < properties.getAgents().getMaxConcurrent()
            && !costTracker.isHourlyLimitReached()
            && rateLimiter.hasToken();
    }

    /**
     * One drain tick: dispatch the head of the queue if every constraint allows it
     *
     * @return true if a job was dispatched
     */
    public boolean drainOnce() {
        synchronized (drainLock) {
            if (state.get() != OrchestratorState.RUNNING) {
                return false;
            }
            Optional<Job> head = jobQueue.peek();
            if (head.isEmpty() || !canProcessJob()) {
                return false;
            }
            Job job = head.get();

            Optional<Worker> leased;
            try {
                leased = workerPool.getAvailableWorker(job.getSelectedModel());
            } catch (RuntimeException e) {
                log.warn("Worker lookup failed for job {}, leaving it queued: {}", job.getId(), e.getMessage());
                return false;
            }
            if (leased.isEmpty()) {
                log.debug("No idle {} worker for job {}, leaving it queued", job.getSelectedModel(), job.getId());
                return false;
            }
            Worker worker = leased.get();

            if (!rateLimiter.tryAcquire()) {
                releaseQuietly(worker);
                return false;
            }
            if (!jobQueue.removeHead(job)) {
                // queue was cleared between peek and dispatch
                rateLimiter.refund();
                releaseQuietly(worker);
                return false;
            }

            job.markActive(clock.instant());
            activeJobs.put(job.getId(), job);
            log.info("Dispatching job {} to worker {} (attempt {}), active jobs: {}",
                job.getId(), worker.getId(), job.getAttempts(), activeJobs.size());

            execute(job, worker);
            return true;
        }
    }

    /**
     * Run the blocking worker call off the drain thread, bounded by the job's timeout
     */
    private void execute(Job job, Worker worker) {
        long start = System.nanoTime();
        Mono.fromCallable(() -> worker.executeJob(job))
            .subscribeOn(jobScheduler)
            .timeout(Duration.ofMillis(job.getTimeoutMs()))
            .onErrorMap(TimeoutException.class, e -> new WorkerExecutionException(
                "Job " + job.getId() + " timed out after " + job.getTimeoutMs() + "ms", e))
            // release before reporting, so the next drain tick can lease it
            .doOnTerminate(() -> releaseQuietly(worker))
            .doOnSuccess(result -> finish(job, result, null, elapsedMillis(start)))
            .doOnError(error -> finish(job, null, error, elapsedMillis(start)))
            .onErrorResume(e -> Mono.empty())
            .subscribe();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private void finish(Job job, JobResult result, Throwable failure, long executionTimeMs) {
        try {
            // the estimate is charged whether or not the attempt succeeded
            chargeJob(job);
            if (failure == null) {
                job.markCompleted(clock.instant());
                metrics.jobCompleted(executionTimeMs);
                log.info("Job {} completed in {}ms, charged ${}", job.getId(), executionTimeMs, job.getEstimatedCost());
                publish(new JobCompletedEvent(
                    job.getId(), result, executionTimeMs, job.getEstimatedCost(), clock.instant()));
            } else {
                String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
                job.markFailed(clock.instant(), error);
                metrics.jobFailed();
                log.error("Job {} failed after {} attempt(s): {}", job.getId(), job.getAttempts(), error, failure);
                publish(new JobFailedEvent(job.getId(), error, job.getAttempts(), clock.instant()));
            }
        } finally {
            removeActive(job);
        }
    }

    private void chargeJob(Job job) {
        Optional<CostAlert> alert = costTracker.record(job.getEstimatedCost());
        if (alert.isEmpty()) {
            return;
        }
        CostAlert costAlert = alert.get();
        log.warn("Cost alert {}: daily spend at {}% of limit", costAlert.getLevel(),
            Math.round(costAlert.getPercentage()));
        publish(new CostAlertEvent(costAlert.getLevel(), costAlert.getPercentage(), clock.instant()));

        if (costAlert.getLevel() == CostAlertLevel.EMERGENCY
                && properties.getCostControls().isAutoShutdownOnOverspend()) {
            emergencyShutdown("Cost limit exceeded");
        }
    }

    private void publish(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Event listener failed for {}", event.getClass().getSimpleName(), e);
        }
    }

    private void releaseQuietly(Worker worker) {
        try {
            workerPool.releaseWorker(worker);
        } catch (RuntimeException e) {
            log.warn("Failed to release worker {}: {}", worker.getId(), e.getMessage());
        }
    }

    private void removeActive(Job job) {
        activeLock.lock();
        try {
            activeJobs.remove(job.getId());
            if (activeJobs.isEmpty()) {
                activeDrained.signalAll();
            }
        } finally {
            activeLock.unlock();
        }
    }

    /**
     * Stop admissions, drop the queue now, and run the graceful shutdown after a short delay
     * so in-flight jobs can report. Only the first call has any effect.
     */
    public void emergencyShutdown(String reason) {
        if (!emergencyTriggered.compareAndSet(false, true)) {
            return;
        }
        if (state.get() == OrchestratorState.STOPPED) {
            log.warn("Emergency shutdown requested ({}) but orchestrator is already stopped", reason);
            return;
        }
        log.warn("Emergency shutdown: {}", reason);
        state.set(OrchestratorState.SHUTTING_DOWN);

        List<Job> discarded = jobQueue.clear();
        publish(new EmergencyShutdownEvent(reason, discarded.size(), clock.instant()));

        Duration delay = properties.getShutdown().getEmergencyDelay();
        taskScheduler.schedule(this::shutdown, clock.instant().plus(delay));
        log.warn("Discarded {} queued jobs, graceful shutdown in {}ms", discarded.size(), delay.toMillis());
    }

    /**
     * Stop admissions and wait, up to the grace period, for active jobs to finish; then discard the
     * queue and release the worker pool. Blocks the caller. Repeated calls return immediately.
     */
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress or complete");
            return;
        }
        log.info("Initiating graceful shutdown...");
        state.set(OrchestratorState.SHUTTING_DOWN);

        Duration gracePeriod = properties.getShutdown().getGracePeriod();
        if (!awaitActiveJobs(gracePeriod)) {
            log.warn("Grace period of {}ms elapsed with {} jobs still active",
                gracePeriod.toMillis(), activeJobs.size());
        }
        int abandoned = activeJobs.size();

        List<Job> discarded = jobQueue.clear();
        if (!discarded.isEmpty()) {
            log.info("Discarded {} queued jobs without executing them", discarded.size());
        }

        try {
            workerPool.shutdown();
        } catch (RuntimeException e) {
            log.error("Worker pool shutdown failed", e);
        }

        state.set(OrchestratorState.STOPPED);
        publish(new ShutdownCompleteEvent(abandoned, clock.instant()));
        log.info("Shutdown complete");
    }

    @PreDestroy
    public void close() {
        if (state.get() != OrchestratorState.STOPPED) {
            shutdown();
        }
    }

    private boolean awaitActiveJobs(Duration timeout) {
        long remaining = timeout.toNanos();
        activeLock.lock();
        try {
            while (!activeJobs.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = activeDrained.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            activeLock.unlock();
        }
    }

    /**
     * Refill tick for the rate limiter
     */
    public void refillRateLimiter() {
        if (state.get() != OrchestratorState.STOPPED) {
            rateLimiter.refillIfDue();
        }
    }

    /**
     * Spend window tick
     */
    public void tickCostWindows() {
        costTracker.tick();
    }

    /**
     * Throughput aggregation tick
     */
    public void aggregateMetrics() {
        metrics.aggregate(clock.millis());
    }

    public OrchestratorStatus getStatus() {
        return OrchestratorStatus.builder()
            .state(state.get())
            .activeJobs(activeJobs.size())
            .queuedJobs(jobQueue.size())
            .totalAgents(state.get() == OrchestratorState.UNINITIALIZED ? 0 : workerPool.getTotalWorkers())
            .metrics(metrics.snapshot(costTracker.getTotalSpend()))
            .costTracker(costTracker.snapshot())
            .rateLimiter(OrchestratorStatus.RateLimiterInfo.builder()
                .tokensAvailable(rateLimiter.availableTokens())
                .requestsPerMinute(rateLimiter.getRequestsPerMinute())
                .build())
            .build();
    }

    public OrchestratorState getState() {
        return state.get();
    }

    /**
     * 1-based queue position of a job, 0 if it is not queued
     */
    public int getJobPosition(String jobId) {
        return jobQueue.positionOf(jobId);
    }

    public List<Job> getActiveJobs() {
        return new ArrayList<>(activeJobs.values());
    }

    CostTracker getCostTracker() {
        return costTracker;
    }

    TokenBucketRateLimiter getRateLimiter() {
        return rateLimiter;
    }
}

package com.whereq.tollgate.worker;

import com.whereq.tollgate.exception.WorkerExecutionException;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process worker pool with a fixed number of workers per model tier.
 *
 * <p>Each worker runs the {@link JobHandler} on the calling thread. The orchestrator moves the
 * call off its drain thread and enforces the job's {@code timeoutMs}.
 */
@Slf4j
public class LocalWorkerPool implements WorkerPool {

    private final Collection<String> models;
    private final int workersPerModel;
    private final JobHandler handler;
    private final Map<String, Deque<Worker>> idleWorkers = new LinkedHashMap<>();

    private int totalWorkers;
    private boolean running;

    public LocalWorkerPool(Collection<String> models, int workersPerModel, JobHandler handler) {
        if (workersPerModel <= 0) {
            throw new IllegalArgumentException("workersPerModel must be positive: " + workersPerModel);
        }
        this.models = models;
        this.workersPerModel = workersPerModel;
        this.handler = handler;
    }

    @Override
    public synchronized void initialize() {
        if (running) {
            return;
        }
        for (String model : models) {
            Deque<Worker> workers = idleWorkers.computeIfAbsent(model, m -> new ArrayDeque<>());
            for (int i = 0; i < workersPerModel; i++) {
                workers.add(new LocalWorker(model + "-" + (i + 1), model));
                totalWorkers++;
            }
        }
        running = true;
        log.info("LocalWorkerPool initialized: {} workers across models {}", totalWorkers, idleWorkers.keySet());
    }

    @Override
    public synchronized Optional<Worker> getAvailableWorker(String model) {
        if (!running) {
            return Optional.empty();
        }
        Deque<Worker> workers = idleWorkers.get(model);
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(workers.poll());
    }

    @Override
    public synchronized void releaseWorker(Worker worker) {
        if (!running) {
            return;
        }
        Deque<Worker> workers = idleWorkers.get(worker.getModel());
        if (workers == null) {
            log.warn("Attempted to release unknown worker {}", worker.getId());
            return;
        }
        workers.add(worker);
    }

    @Override
    public synchronized int getTotalWorkers() {
        return totalWorkers;
    }

    @Override
    public synchronized void shutdown() {
        running = false;
        idleWorkers.clear();
        totalWorkers = 0;
        log.info("LocalWorkerPool shut down");
    }

    private synchronized boolean isRunning() {
        return running;
    }

    private class LocalWorker implements Worker {
        private final String id;
        private final String model;

        LocalWorker(String id, String model) {
            this.id = id;
            this.model = model;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getModel() {
            return model;
        }

        @Override
        public JobResult executeJob(Job job) throws WorkerExecutionException {
            if (!isRunning()) {
                throw new WorkerExecutionException("Worker pool is not running");
            }
            try {
                JobResult result = handler.handle(job, model);
                if (result != null && result.getWorkerId() == null) {
                    result.setWorkerId(id);
                }
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerExecutionException("Interrupted while running job " + job.getId(), e);
            } catch (WorkerExecutionException e) {
                throw e;
            } catch (Exception e) {
                throw new WorkerExecutionException(e.getMessage(), e);
            }
        }
    }
}

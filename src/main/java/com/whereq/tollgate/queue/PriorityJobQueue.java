package com.whereq.tollgate.queue;

import com.whereq.tollgate.model.Job;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory job queue ordered by priority weight, then by arrival sequence.
 *
 * <p>Backed by a list kept sorted on insert, which is enough for queue depths in the
 * low hundreds. There is no aging: a steady stream of HIGH jobs starves LOW ones.
 */
@Slf4j
public class PriorityJobQueue implements JobQueue {

    /**
     * Higher weight first, then lower arrival sequence
     */
    static final Comparator<Job> DISPATCH_ORDER = Comparator
        .comparingInt((Job job) -> job.getPriority().getWeight()).reversed()
        .thenComparingLong(Job::getSequence);

    private final List<Job> jobs = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public Optional<Integer> offer(Job job, int maxSize) {
        lock.lock();
        try {
            if (jobs.size() >= maxSize) {
                return Optional.empty();
            }
            int index = insertionIndex(job);
            jobs.add(index, job);
            log.debug("Enqueued job {} at position {}, queue size: {}", job.getId(), index + 1, jobs.size());
            return Optional.of(index + 1);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> peek() {
        lock.lock();
        try {
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeHead(Job job) {
        lock.lock();
        try {
            if (!jobs.isEmpty() && jobs.get(0) == job) {
                jobs.remove(0);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int positionOf(String jobId) {
        lock.lock();
        try {
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).getId().equals(jobId)) {
                    return i + 1;
                }
            }
            return 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Job> clear() {
        lock.lock();
        try {
            List<Job> discarded = new ArrayList<>(jobs);
            jobs.clear();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    // position after every queued job that dispatches before this one
    private int insertionIndex(Job job) {
        int index = jobs.size();
        while (index > 0 && DISPATCH_ORDER.compare(jobs.get(index - 1), job) > 0) {
            index--;
        }
        return index;
    }
}

package com.whereq.tollgate.queue;

import com.whereq.tollgate.model.Job;

import java.util.List;
import java.util.Optional;

/**
 * Bounded queue of admitted jobs waiting for execution
 */
public interface JobQueue {
    /**
     * Enqueue a job unless the queue already holds {@code maxSize} jobs.
     * The capacity check and the insert are atomic.
     *
     * @param job the job to enqueue
     * @param maxSize maximum allowed size
     * @return 1-based queue position, or empty if the queue is full
     */
    Optional<Integer> offer(Job job, int maxSize);

    /**
     * Next job to run, without removing it
     */
    Optional<Job> peek();

    /**
     * Remove the given job if it is still the head of the queue
     *
     * @param job expected head
     * @return true if removed
     */
    boolean removeHead(Job job);

    /**
     * 1-based position of a job, or 0 if it is not queued
     */
    int positionOf(String jobId);

    /**
     * Drop every queued job
     *
     * @return the discarded jobs, in queue order
     */
    List<Job> clear();

    /**
     * Get current queue size
     */
    int size();
}

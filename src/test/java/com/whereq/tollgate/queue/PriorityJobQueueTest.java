package com.whereq.tollgate.queue;

import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.whereq.tollgate.support.TestJobs.job;
import static org.assertj.core.api.Assertions.assertThat;

class PriorityJobQueueTest {

    PriorityJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new PriorityJobQueue();
    }

    // ------------------------------------------------------------------
    // ordering
    // ------------------------------------------------------------------

    @Test
    void peek_mixedPriorities_returnsHighestWeightFirst() {
        queue.offer(job("low", JobPriority.LOW), 10);
        queue.offer(job("high", JobPriority.HIGH), 10);
        queue.offer(job("normal", JobPriority.NORMAL), 10);

        assertThat(queue.peek()).map(Job::getId).contains("high");
        assertThat(queue.clear()).extracting(Job::getId).containsExactly("high", "normal", "low");
    }

    @Test
    void offer_samePriority_keepsArrivalOrder() {
        queue.offer(job("n1", JobPriority.NORMAL), 10);
        queue.offer(job("h1", JobPriority.HIGH), 10);
        queue.offer(job("n2", JobPriority.NORMAL), 10);
        queue.offer(job("h2", JobPriority.HIGH), 10);

        assertThat(queue.clear()).extracting(Job::getId).containsExactly("h1", "h2", "n1", "n2");
    }

    @Test
    void offer_samePriorityOfferedOutOfSequence_ordersByArrivalSequence() {
        Job earlier = job("earlier", JobPriority.NORMAL);
        Job later = job("later", JobPriority.NORMAL);
        queue.offer(job("low", JobPriority.LOW), 10);
        queue.offer(later, 10);

        assertThat(queue.offer(earlier, 10)).contains(1);
        assertThat(queue.clear()).extracting(Job::getId).containsExactly("earlier", "later", "low");
    }

    @Test
    void offer_returnsOneBasedPosition() {
        assertThat(queue.offer(job("n1", JobPriority.NORMAL), 10)).contains(1);
        assertThat(queue.offer(job("l1", JobPriority.LOW), 10)).contains(2);
        assertThat(queue.offer(job("h1", JobPriority.HIGH), 10)).contains(1);

        assertThat(queue.positionOf("l1")).isEqualTo(3);
        assertThat(queue.positionOf("missing")).isZero();
    }

    // ------------------------------------------------------------------
    // capacity
    // ------------------------------------------------------------------

    @Test
    void offer_atCapacity_rejectsWithoutChangingQueue() {
        queue.offer(job("a", JobPriority.LOW), 2);
        queue.offer(job("b", JobPriority.LOW), 2);

        Optional<Integer> result = queue.offer(job("c", JobPriority.HIGH), 2);

        assertThat(result).isEmpty();
        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.positionOf("c")).isZero();
    }

    // ------------------------------------------------------------------
    // head removal and clear
    // ------------------------------------------------------------------

    @Test
    void removeHead_onlyRemovesExpectedHead() {
        Job first = job("first", JobPriority.HIGH);
        Job second = job("second", JobPriority.LOW);
        queue.offer(first, 10);
        queue.offer(second, 10);

        assertThat(queue.removeHead(second)).isFalse();
        assertThat(queue.removeHead(first)).isTrue();
        assertThat(queue.peek()).contains(second);
    }

    @Test
    void clear_returnsDiscardedJobsInQueueOrder() {
        queue.offer(job("low", JobPriority.LOW), 10);
        queue.offer(job("high", JobPriority.HIGH), 10);

        List<Job> discarded = queue.clear();

        assertThat(discarded).extracting(Job::getId).containsExactly("high", "low");
        assertThat(queue.size()).isZero();
        assertThat(queue.peek()).isEmpty();
    }
}

package com.whereq.tollgate.service;

import com.whereq.tollgate.budget.CostTracker;
import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.exception.AdmissionRejectedException;
import com.whereq.tollgate.exception.AdmissionRejectedException.Reason;
import com.whereq.tollgate.model.JobPriority;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.queue.PriorityJobQueue;
import com.whereq.tollgate.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.whereq.tollgate.support.TestJobs.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AdmissionControllerTest {

    SimpleMeterRegistry registry;
    CostTracker costTracker;
    PriorityJobQueue queue;
    OrchestratorMetrics metrics;
    AdmissionController admission;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        registry = new SimpleMeterRegistry();
        costTracker = new CostTracker(new TollgateProperties.CostControlsConfig(), clock);
        queue = new PriorityJobQueue();
        metrics = new OrchestratorMetrics(registry, clock.millis());
        admission = new AdmissionController(2, costTracker, queue, metrics);
    }

    @Test
    void checkAccepting_running_passes() {
        assertThatCode(() -> admission.checkAccepting(OrchestratorState.RUNNING)).doesNotThrowAnyException();
    }

    @Test
    void checkAccepting_uninitialized_rejectsNotInitialized() {
        assertThatThrownBy(() -> admission.checkAccepting(OrchestratorState.UNINITIALIZED))
            .isInstanceOf(AdmissionRejectedException.class)
            .hasMessage("Orchestrator not initialized");
    }

    @Test
    void checkAccepting_stopped_rejectsShuttingDown() {
        AdmissionRejectedException e = catchThrowableOfType(
            () -> admission.checkAccepting(OrchestratorState.STOPPED), AdmissionRejectedException.class);

        assertThat(e.getReason()).isEqualTo(Reason.SHUTTING_DOWN);
    }

    @Test
    void checkBudget_dailyCheckedBeforeHourly() {
        costTracker.record(10.0);

        assertThatThrownBy(() -> admission.checkBudget())
            .isInstanceOf(AdmissionRejectedException.class)
            .hasMessage("Daily spend limit exceeded");
    }

    @Test
    void checkBudget_hourlyLimitReached_rejects() {
        costTracker.record(2.0);

        assertThatThrownBy(() -> admission.checkBudget())
            .hasMessage("Hourly spend limit exceeded");
    }

    @Test
    void enqueue_full_rejectsAndCountsReason() {
        assertThat(admission.enqueue(job("a", JobPriority.NORMAL))).isEqualTo(1);
        assertThat(admission.enqueue(job("b", JobPriority.HIGH))).isEqualTo(1);

        assertThatThrownBy(() -> admission.enqueue(job("c", JobPriority.HIGH)))
            .isInstanceOf(AdmissionRejectedException.class)
            .hasMessage("Queue at capacity");

        assertThat(queue.size()).isEqualTo(2);
        assertThat(registry.counter("tollgate.admission.rejected", "reason", "QUEUE_FULL").count()).isEqualTo(1.0);
        assertThat(metrics.snapshot(0).getTotalJobsRejected()).isEqualTo(1);
    }
}

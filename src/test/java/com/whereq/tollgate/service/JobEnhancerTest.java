package com.whereq.tollgate.service;

import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.model.Complexity;
import com.whereq.tollgate.model.Job;
import com.whereq.tollgate.model.JobPriority;
import com.whereq.tollgate.model.JobState;
import com.whereq.tollgate.pricing.CostModel;
import com.whereq.tollgate.pricing.ModelSelector;
import com.whereq.tollgate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.whereq.tollgate.support.TestJobs.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobEnhancerTest {

    @Mock CostModel costModel;

    MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    JobEnhancer enhancer;

    @BeforeEach
    void setUp() {
        enhancer = new JobEnhancer(costModel,
            new ModelSelector(new TollgateProperties.ModelSelectionConfig()),
            new TollgateProperties.QueueConfig(), clock);
    }

    @Test
    void enhance_assignsIdentityTierEstimatesAndTimeout() {
        when(costModel.classify(any())).thenReturn(Complexity.COMPLEX);
        when(costModel.estimateUnits(any())).thenReturn(500L);
        when(costModel.predictCost(500L, "claude-3-opus")).thenReturn(0.0075);

        Job job = enhancer.enhance(request(JobPriority.HIGH), 0.1);

        assertThat(job.getId()).startsWith("job-");
        assertThat(job.getPriority()).isEqualTo(JobPriority.HIGH);
        assertThat(job.getComplexity()).isEqualTo(Complexity.COMPLEX);
        assertThat(job.getSelectedModel()).isEqualTo("claude-3-opus");
        assertThat(job.getEstimatedUnits()).isEqualTo(500L);
        assertThat(job.getEstimatedCost()).isEqualTo(0.0075);
        assertThat(job.getTimeoutMs()).isEqualTo(45_000L);
        assertThat(job.getSubmittedAt()).isEqualTo(clock.instant());
        assertThat(job.getState()).isEqualTo(JobState.QUEUED);
        assertThat(job.getAttempts()).isZero();
    }

    @Test
    void enhance_missingPriority_defaultsToNormal() {
        when(costModel.classify(any())).thenReturn(Complexity.MODERATE);
        when(costModel.estimateUnits(any())).thenReturn(100L);
        when(costModel.predictCost(anyLong(), eq("claude-3-sonnet"))).thenReturn(0.0003);

        Job job = enhancer.enhance(JobRequest.builder().agentType("a").action("b").build(), 0.0);

        assertThat(job.getPriority()).isEqualTo(JobPriority.NORMAL);
        assertThat(job.getTimeoutMs()).isEqualTo(90_000L);
    }

    @Test
    void enhance_underBudgetPressure_pricesOnCheapestTier() {
        when(costModel.classify(any())).thenReturn(Complexity.COMPLEX);
        when(costModel.estimateUnits(any())).thenReturn(1000L);
        when(costModel.predictCost(1000L, "claude-3-haiku")).thenReturn(0.00025);

        Job job = enhancer.enhance(request(JobPriority.LOW), 0.85);

        assertThat(job.getSelectedModel()).isEqualTo("claude-3-haiku");
        assertThat(job.getEstimatedCost()).isEqualTo(0.00025);
        assertThat(job.getTimeoutMs()).isEqualTo(180_000L);
    }

    @Test
    void enhance_generatesDistinctIdsAndIncreasingSequence() {
        when(costModel.classify(any())).thenReturn(Complexity.MODERATE);

        Job first = enhancer.enhance(request(JobPriority.NORMAL), 0.0);
        Job second = enhancer.enhance(request(JobPriority.NORMAL), 0.0);

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(second.getSequence()).isGreaterThan(first.getSequence());
    }

    @Test
    void enhance_negativeCostEstimate_rejected() {
        when(costModel.classify(any())).thenReturn(Complexity.MODERATE);
        when(costModel.estimateUnits(any())).thenReturn(100L);
        when(costModel.predictCost(100L, "claude-3-sonnet")).thenReturn(-0.01);

        assertThatThrownBy(() -> enhancer.enhance(request(JobPriority.NORMAL), 0.0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("claude-3-sonnet")
            .hasMessageContaining("-0.01");
    }

    @Test
    void enhance_nonFiniteCostEstimate_rejected() {
        when(costModel.classify(any())).thenReturn(Complexity.MODERATE);
        when(costModel.estimateUnits(any())).thenReturn(100L);
        when(costModel.predictCost(100L, "claude-3-sonnet"))
            .thenReturn(Double.NaN, Double.POSITIVE_INFINITY);

        assertThatThrownBy(() -> enhancer.enhance(request(JobPriority.NORMAL), 0.0))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> enhancer.enhance(request(JobPriority.NORMAL), 0.0))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void enhance_zeroCostEstimate_accepted() {
        when(costModel.classify(any())).thenReturn(Complexity.SIMPLE);
        when(costModel.estimateUnits(any())).thenReturn(0L);
        when(costModel.predictCost(0L, "claude-3-haiku")).thenReturn(0.0);

        assertThat(enhancer.enhance(request(JobPriority.NORMAL), 0.0).getEstimatedCost()).isZero();
    }
}

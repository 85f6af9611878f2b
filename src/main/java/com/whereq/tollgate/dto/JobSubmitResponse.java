package com.whereq.tollgate.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * 1-based position in the queue at admission time
     */
    private int queuePosition;

    /**
     * Cost charged when the job finishes
     */
    private double estimatedCost;

    /**
     * Model tier the job will run on
     */
    private String selectedModel;

    private Instant submittedAt;

    /**
     * Rejection reason (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}

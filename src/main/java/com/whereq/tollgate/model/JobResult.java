package com.whereq.tollgate.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result reported by a worker for a completed job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Worker that executed the job
     */
    private String workerId;

    /**
     * Text output
     */
    private String output;

    /**
     * Structured output, if the worker produced any
     */
    private JsonNode result;

    /**
     * Units actually consumed as reported by the worker (informational only, never billed)
     */
    private long unitsUsed;

    /**
     * When the worker finished
     */
    private Instant completedAt;
}

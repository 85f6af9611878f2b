package com.whereq.tollgate.dto;

import com.whereq.tollgate.model.JobPriority;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

/**
 * Job submission request.
 *
 * The orchestrator never interprets the payload; it is priced by the cost model
 * and handed to the worker unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Kind of agent expected to run the job (e.g. requirements-analyzer)
     */
    @NotBlank
    private String agentType;

    /**
     * Action the agent performs (e.g. analyze, generateTests)
     */
    @NotBlank
    private String action;

    /**
     * Opaque job input
     */
    private Map<String, Object> payload;

    /**
     * Priority hint, NORMAL when absent
     */
    private JobPriority priority;

    /**
     * Free-form caller metadata
     */
    private Map<String, String> metadata;

    /**
     * Correlation id propagated into logs
     */
    private String correlationId;
}

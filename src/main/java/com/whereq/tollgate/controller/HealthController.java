package com.whereq.tollgate.controller;

import com.whereq.tollgate.dto.OrchestratorStatus;
import com.whereq.tollgate.model.OrchestratorState;
import com.whereq.tollgate.service.JobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify the orchestrator is accepting jobs.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final JobOrchestrator orchestrator;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the orchestrator is running and within budget")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(orchestrator::getStatus)
            .map(status -> {
                boolean up = status.getState() == OrchestratorState.RUNNING;

                Map<String, Object> health = new HashMap<>();
                health.put("status", up ? "UP" : "DOWN");
                health.put("service", "whereq-tollgate");
                health.put("orchestrator", orchestratorInfo(status));

                return ResponseEntity
                    .status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                    .body(health);
            });
    }

    private Map<String, String> orchestratorInfo(OrchestratorStatus status) {
        Map<String, String> info = new HashMap<>();
        info.put("state", status.getState().name());
        info.put("activeJobs", String.valueOf(status.getActiveJobs()));
        info.put("queuedJobs", String.valueOf(status.getQueuedJobs()));
        info.put("totalAgents", String.valueOf(status.getTotalAgents()));
        if (status.getCostTracker() != null) {
            info.put("remainingDailyBudget", String.format("%.4f", status.getCostTracker().getRemainingDailyBudget()));
        }
        return info;
    }
}

package com.whereq.tollgate.controller;

import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.dto.JobSubmitResponse;
import com.whereq.tollgate.dto.OrchestratorStatus;
import com.whereq.tollgate.exception.AdmissionRejectedException;
import com.whereq.tollgate.service.JobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Controller for job submission and orchestrator status
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Job admission and orchestrator status")
public class JobController {

    private final JobOrchestrator orchestrator;

    /**
     * Submit a job for budget-checked execution
     *
     * @param request job request
     * @param correlationId caller correlation id
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Submit a job", description = "Price the job and queue it, or reject it with a reason")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(
            @Valid @RequestBody JobRequest request,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        if (request.getCorrelationId() == null) {
            request.setCorrelationId(correlationId);
        }
        log.info("Received job submission: agentType={}, action={}, priority={}, correlationId={}",
            request.getAgentType(), request.getAction(), request.getPriority(), request.getCorrelationId());

        return Mono.fromCallable(() -> orchestrator.submitJob(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(response))
            .onErrorResume(AdmissionRejectedException.class, e -> {
                log.warn("Job rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(statusFor(e.getReason()))
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Point-in-time orchestrator status
     */
    @GetMapping("/status")
    @Operation(summary = "Orchestrator status", description = "Queue, active jobs, spend and rate limiter state")
    public Mono<ResponseEntity<OrchestratorStatus>> getStatus() {
        return Mono.fromSupplier(orchestrator::getStatus)
            .map(ResponseEntity::ok);
    }

    private HttpStatus statusFor(AdmissionRejectedException.Reason reason) {
        if (reason.isBudgetRelated()) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}

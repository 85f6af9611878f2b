package com.whereq.tollgate.exception;

/**
 * Thrown synchronously from job submission when a job cannot be admitted.
 * Nothing is queued or charged when this is thrown.
 */
public class AdmissionRejectedException extends RuntimeException {

    private final Reason reason;

    public AdmissionRejectedException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Why a submission was rejected
     */
    public enum Reason {
        NOT_INITIALIZED("Orchestrator not initialized"),
        SHUTTING_DOWN("Orchestrator is shutting down"),
        DAILY_SPEND_LIMIT("Daily spend limit exceeded"),
        HOURLY_SPEND_LIMIT("Hourly spend limit exceeded"),
        QUEUE_FULL("Queue at capacity");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        public boolean isBudgetRelated() {
            return this == DAILY_SPEND_LIMIT || this == HOURLY_SPEND_LIMIT;
        }
    }
}

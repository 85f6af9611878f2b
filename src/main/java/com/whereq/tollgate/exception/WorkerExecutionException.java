package com.whereq.tollgate.exception;

/**
 * Raised by a worker when a job fails or exceeds its timeout
 */
public class WorkerExecutionException extends Exception {
    public WorkerExecutionException(String message) {
        super(message);
    }

    public WorkerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

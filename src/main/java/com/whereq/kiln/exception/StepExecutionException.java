package com.whereq.kiln.exception;

/**
 * Failure reported by a step implementation. Recorded on the step,
 * fails the step's phase, never crashes the scheduler.
 */
public class StepExecutionException extends RuntimeException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.whereq.kiln.model;

/**
 * Job lifecycle states as seen by callers
 *
 * State transitions:
 * QUEUED → ACTIVE → {COMPLETED, FAILED}
 * FAILED → QUEUED (after backoff, while attempts &lt; maxAttempts)
 * FAILED → DEAD_LETTERED (attempts exhausted)
 */
public enum JobState {
    /**
     * Admitted, waiting for a worker
     */
    QUEUED,

    /**
     * Pulled by a worker, build lifecycle running
     */
    ACTIVE,

    /**
     * Build finished successfully
     */
    COMPLETED,

    /**
     * Last attempt failed; either waiting for a retry or terminally failed
     */
    FAILED,

    /**
     * Retry budget exhausted, requires manual resubmission
     */
    DEAD_LETTERED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTERED;
    }
}

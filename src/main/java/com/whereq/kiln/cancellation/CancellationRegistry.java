package com.whereq.kiln.cancellation;

/**
 * Process-wide cancellation flags, keyed by build id.
 * A flag is set at most once and only dropped when the build is purged or resubmitted.
 */
public interface CancellationRegistry {

    /**
     * Request cancellation of a build. Idempotent.
     *
     * @param buildId build identifier
     * @return true if this call set the flag, false if it was already set
     */
    boolean request(String buildId);

    /**
     * Pure read, safe to call from concurrently running steps.
     *
     * @param buildId build identifier
     * @return whether cancellation was requested
     */
    boolean isCancelled(String buildId);

    /**
     * Drop the flag of a build that was purged or resubmitted.
     */
    void forget(String buildId);
}

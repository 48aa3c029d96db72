package com.whereq.kiln.exception;

/**
 * Thrown when a build observes its cancellation flag.
 * Kept apart from ordinary failures so callers can tell a user stop from a defect.
 */
public class BuildCancelledException extends RuntimeException {

    private final String buildId;

    public BuildCancelledException(String buildId) {
        super("Build " + buildId + " was cancelled");
        this.buildId = buildId;
    }

    public String getBuildId() {
        return buildId;
    }
}

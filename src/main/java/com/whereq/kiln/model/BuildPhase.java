package com.whereq.kiln.model;

/**
 * Ordered phases of a build. A build only moves forward through this order
 * or jumps to {@link #FAILED}.
 */
public enum BuildPhase {
    PENDING,
    PARSING,
    VALIDATING,
    RESOLVING,
    GENERATING,
    BUILDING,
    ARTIFACT_GENERATING,
    UPLOADING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /**
     * Whether a build in this phase may move to {@code next}
     */
    public boolean canTransitionTo(BuildPhase next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() > ordinal();
    }
}

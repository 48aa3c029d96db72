package com.whereq.kiln.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Terminal result of one lifecycle run, reported back to the job queue
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BuildOutcome {

    private final String buildId;

    /**
     * COMPLETED, FAILED or CANCELLED
     */
    private final BuildEventType status;

    /**
     * Produced (or cached) artifact references
     */
    private final List<String> artifacts;

    /**
     * Failure reason, null on success
     */
    private final String reason;

    /**
     * Whether building was skipped thanks to the artifact cache
     */
    private final boolean cacheHit;

    public static BuildOutcome completed(String buildId, List<String> artifacts, boolean cacheHit) {
        return new BuildOutcome(buildId, BuildEventType.COMPLETED, List.copyOf(artifacts), null, cacheHit);
    }

    public static BuildOutcome failed(String buildId, String reason) {
        return new BuildOutcome(buildId, BuildEventType.FAILED, List.of(), reason, false);
    }

    public static BuildOutcome cancelled(String buildId) {
        return new BuildOutcome(buildId, BuildEventType.CANCELLED, List.of(), "Cancelled", false);
    }

    public boolean isSuccess() {
        return status == BuildEventType.COMPLETED;
    }

    public boolean isCancelled() {
        return status == BuildEventType.CANCELLED;
    }
}

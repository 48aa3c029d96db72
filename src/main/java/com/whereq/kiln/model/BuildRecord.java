package com.whereq.kiln.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lifecycle record of one build attempt. Mutated only by the lifecycle machine;
 * readers get consistent values through the synchronized accessors.
 */
public class BuildRecord {

    @Getter
    private final String buildId;

    @Getter
    private final int attempt;

    @Getter
    private final Instant createdAt;

    private BuildPhase phase = BuildPhase.PENDING;
    private final List<String> artifacts = new ArrayList<>();
    private String failureReason;
    private boolean cancelled;
    private boolean cacheHit;
    private Instant updatedAt;

    public BuildRecord(String buildId, int attempt, Instant createdAt) {
        this.buildId = buildId;
        this.attempt = attempt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Move to the next phase.
     *
     * @throws IllegalStateException if the move would regress or leave a terminal phase
     */
    public synchronized void advanceTo(BuildPhase next, Instant at) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Build " + buildId + " cannot move from " + phase + " to " + next);
        }
        phase = next;
        updatedAt = at;
    }

    public synchronized void fail(String reason, boolean cancelledByUser, Instant at) {
        advanceTo(BuildPhase.FAILED, at);
        failureReason = reason;
        cancelled = cancelledByUser;
    }

    public synchronized void addArtifacts(List<String> refs) {
        artifacts.addAll(refs);
    }

    public synchronized void markCacheHit() {
        cacheHit = true;
    }

    public synchronized BuildPhase getPhase() {
        return phase;
    }

    public synchronized List<String> getArtifacts() {
        return Collections.unmodifiableList(new ArrayList<>(artifacts));
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized boolean isCacheHit() {
        return cacheHit;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }
}

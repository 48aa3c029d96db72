package com.whereq.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A build request admitted to the job queue.
 * Mutated only by the queue; workers receive snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BuildJob {
    /**
     * Unique job identifier, also used as the build identifier
     */
    private String id;

    /**
     * Normalized build specification
     */
    private BuildSpec spec;

    /**
     * Tenant the job is accounted to; null disables the per-tenant quota
     */
    private String tenantKey;

    @Builder.Default
    private Tier tier = Tier.FREE;

    /**
     * Derived from the tier, lower value is dequeued first
     */
    private int priority;

    /**
     * Monotonic admission sequence, breaks priority ties FIFO
     */
    private long sequence;

    /**
     * Failed attempts so far
     */
    @Builder.Default
    private int attempts = 0;

    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private JobState state = JobState.QUEUED;

    /**
     * True while a failed job waits out its backoff before re-entering the queue
     */
    private boolean retryScheduled;

    /**
     * Reason of the most recent failure
     */
    private String lastError;

    /**
     * Webhook configuration supplied with the request
     */
    private Notifications notifications;

    private Instant submittedAt;

    private Instant updatedAt;

    /**
     * Counts against the tenant quota: waiting, running, or about to be retried
     */
    @JsonIgnore
    public boolean isPending() {
        return state == JobState.QUEUED
            || state == JobState.ACTIVE
            || (state == JobState.FAILED && retryScheduled);
    }

    /**
     * No further transition will happen without manual intervention
     */
    @JsonIgnore
    public boolean isFinished() {
        return state.isTerminal() || (state == JobState.FAILED && !retryScheduled);
    }

    /**
     * Copy that shares no mutable state with this job
     */
    public BuildJob snapshot() {
        return toBuilder()
            .spec(spec == null ? null : spec.copy())
            .notifications(notifications == null ? null : notifications.copy())
            .build();
    }
}

package com.whereq.kiln.dto;

import com.whereq.kiln.model.BuildJob;
import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for build status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String buildId;

    /**
     * Queue-level state
     */
    private JobState status;

    /**
     * Lifecycle phase of the current or last attempt, null before the first dispatch
     */
    private BuildPhase phase;

    private Tier tier;

    /**
     * Failed attempts so far
     */
    private int attempts;

    private int maxAttempts;

    /**
     * Whether a retry is waiting out its backoff
     */
    private boolean retryScheduled;

    /**
     * Most recent failure reason
     */
    private String errorMessage;

    private Instant submittedAt;

    private Instant updatedAt;

    public static JobStatusResponse from(BuildJob job, BuildPhase phase) {
        return JobStatusResponse.builder()
            .buildId(job.getId())
            .status(job.getState())
            .phase(phase)
            .tier(job.getTier())
            .attempts(job.getAttempts())
            .maxAttempts(job.getMaxAttempts())
            .retryScheduled(job.isRetryScheduled())
            .errorMessage(job.getLastError())
            .submittedAt(job.getSubmittedAt())
            .updatedAt(job.getUpdatedAt())
            .build();
    }
}

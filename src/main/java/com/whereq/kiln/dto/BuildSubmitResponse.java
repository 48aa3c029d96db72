package com.whereq.kiln.dto;

import com.whereq.kiln.model.JobState;
import com.whereq.kiln.model.Tier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for build submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSubmitResponse {
    /**
     * Unique build identifier, also the job identifier
     */
    private String buildId;

    private JobState status;

    private Tier tier;

    /**
     * Queue priority derived from the tier
     */
    private int priority;

    /**
     * Content hash of the normalized spec, the artifact cache key
     */
    private String specHash;

    private Instant submittedAt;
}

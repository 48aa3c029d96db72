package com.whereq.kiln.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for build cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildCancellationResponse {
    private String buildId;

    /**
     * False when a cancellation had already been requested
     */
    private boolean newlyRequested;

    private Instant requestedAt;

    private String message;
}

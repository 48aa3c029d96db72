package com.whereq.kiln.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Notification payload for a terminal build state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildEvent {
    private String buildId;

    private BuildEventType status;

    /**
     * Produced artifact references, present on completion
     */
    private List<String> artifacts;

    /**
     * Human-readable failure reason
     */
    private String reason;

    /**
     * Attempt number the event belongs to (1-based)
     */
    private int attempt;

    private Instant timestamp;
}

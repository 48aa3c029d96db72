package com.whereq.kiln.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A job that exhausted its retry budget, kept for diagnosis and manual resubmission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {
    /**
     * Snapshot of the job at the time it was dead-lettered
     */
    private BuildJob job;

    /**
     * Failure reason of the final attempt
     */
    private String reason;

    private Instant deadLetteredAt;
}

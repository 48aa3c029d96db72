package com.whereq.kiln.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time job counts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {
    private int queued;
    private int active;
    private int retrying;
    private int completed;
    private int failed;
    private int deadLettered;
}

package com.whereq.kiln.scheduler;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a step's progress. {@code error} is present iff the step failed.
 */
@Value
public class StepState {

    StepStatus status;

    Instant startedAt;

    Duration duration;

    String error;

    public static final StepState PENDING = new StepState(StepStatus.PENDING, null, null, null);

    static StepState running(Instant startedAt) {
        return new StepState(StepStatus.RUNNING, startedAt, null, null);
    }

    StepState completed(Duration took) {
        return new StepState(StepStatus.COMPLETED, startedAt, took, null);
    }

    StepState failed(Duration took, String message) {
        return new StepState(StepStatus.FAILED, startedAt, took, message);
    }
}

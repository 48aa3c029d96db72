package com.whereq.kiln.scheduler;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.BooleanSupplier;

/**
 * What a running step may know about its surroundings
 */
@Getter
@AllArgsConstructor
public class StepContext {

    private final String buildId;

    private final String stepId;

    private final BooleanSupplier cancellation;

    /**
     * Whether the build was cancelled while this step was running
     */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}

package com.whereq.kiln.scheduler;

/**
 * Callbacks around step execution. Invoked from step threads.
 */
public interface StepListener {

    StepListener NONE = new StepListener() {
    };

    default void onStepStart(String buildId, StepDefinition step) {
    }

    default void onStepComplete(String buildId, StepDefinition step, long durationMs) {
    }

    default void onStepError(String buildId, StepDefinition step, Throwable error) {
    }
}

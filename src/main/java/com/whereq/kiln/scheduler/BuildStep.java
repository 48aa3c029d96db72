package com.whereq.kiln.scheduler;

/**
 * A unit of build work (package resolution, Dockerfile generation, image build, ...).
 * The scheduler only looks at whether it returns or throws, and how long it took.
 */
@FunctionalInterface
public interface BuildStep {

    /**
     * Run the step to completion. Blocking calls are expected; implementations
     * that spawn subprocesses should poll {@link StepContext#isCancelled()} and
     * enforce their own timeout.
     *
     * @param context step context
     * @throws Exception on failure, typically {@link com.whereq.kiln.exception.StepExecutionException}
     */
    void execute(StepContext context) throws Exception;
}

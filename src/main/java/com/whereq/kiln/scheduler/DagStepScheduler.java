package com.whereq.kiln.scheduler;

import com.whereq.kiln.cancellation.CancellationRegistry;
import com.whereq.kiln.exception.BuildCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a set of interdependent steps with bounded concurrency.
 *
 * <p>Each tick: check cancellation, compute the ready set (pending steps whose
 * dependencies all completed), launch the heaviest ready steps into the free
 * slots, then block until at least one in-flight step terminates. Steps run on
 * the shared step executor; the scheduling thread never runs step code.
 *
 * <p>A failed step does not stop its running siblings. Steps depending on it
 * stay pending and are reported as a deadlock once nothing else can progress.
 */
@Slf4j
@Component
public class DagStepScheduler {

    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    private final ExecutorService stepExecutor;
    private final CancellationRegistry cancellationRegistry;
    private final Clock clock;

    public DagStepScheduler(@Qualifier("stepExecutor") ExecutorService stepExecutor,
                            CancellationRegistry cancellationRegistry,
                            Clock clock) {
        this.stepExecutor = stepExecutor;
        this.cancellationRegistry = cancellationRegistry;
        this.clock = clock;
    }

    public DagExecutionResult execute(String buildId, Collection<StepDefinition> steps) {
        return execute(buildId, steps, DEFAULT_MAX_CONCURRENCY, StepListener.NONE);
    }

    /**
     * Execute the steps of one build.
     *
     * @param buildId build the steps belong to, used for cancellation checks
     * @param steps step DAG; ids must be unique
     * @param maxConcurrency maximum steps running at once, at least 1
     * @param listener step callbacks
     * @return execution result; never throws for step failures or deadlocks
     * @throws BuildCancelledException if cancellation is observed before a tick
     */
    public DagExecutionResult execute(String buildId, Collection<StepDefinition> steps,
                                      int maxConcurrency, StepListener listener) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        Map<String, StepDefinition> byId = index(steps);
        Map<String, StepState> states = new ConcurrentHashMap<>();
        byId.keySet().forEach(id -> states.put(id, StepState.PENDING));

        BlockingQueue<String> finished = new LinkedBlockingQueue<>();
        Instant start = clock.instant();
        int running = 0;

        log.info("Starting step execution for build {}: {} steps, maxConcurrency={}",
            buildId, byId.size(), maxConcurrency);

        while (true) {
            if (cancellationRegistry.isCancelled(buildId)) {
                log.warn("Build {} cancelled, not starting further steps ({} still running)", buildId, running);
                throw new BuildCancelledException(buildId);
            }

            if (allTerminated(states)) {
                break;
            }

            List<StepDefinition> ready = readySteps(byId, states);
            int launches = Math.min(ready.size(), maxConcurrency - running);
            for (int i = 0; i < launches; i++) {
                launch(buildId, ready.get(i), states, finished, listener);
                running++;
            }

            if (running == 0) {
                // nothing ready, nothing running, something still pending
                Map<String, Set<String>> blocked = blockedSteps(byId, states);
                DagExecutionResult result = result(DagExecutionResult.Outcome.DEADLOCKED, start, byId, states, blocked);
                log.error("Deadlock detected in build {}: {}", buildId, result.diagnostic());
                return result;
            }

            running -= awaitCompletion(buildId, finished);
        }

        boolean success = states.values().stream().allMatch(s -> s.getStatus() == StepStatus.COMPLETED);
        DagExecutionResult result = result(
            success ? DagExecutionResult.Outcome.SUCCEEDED : DagExecutionResult.Outcome.FAILED,
            start, byId, states, Map.of());

        log.info("Step execution for build {} finished: success={}, duration={}ms",
            buildId, success, result.getTotalDuration().toMillis());
        return result;
    }

    private Map<String, StepDefinition> index(Collection<StepDefinition> steps) {
        Map<String, StepDefinition> byId = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            if (byId.putIfAbsent(step.getId(), step) != null) {
                throw new IllegalArgumentException("Duplicate step id: " + step.getId());
            }
        }
        return byId;
    }

    private boolean allTerminated(Map<String, StepState> states) {
        return states.values().stream().allMatch(s -> s.getStatus().isTerminal());
    }

    /**
     * Pending steps whose dependencies all completed, heaviest first;
     * equal weights keep declaration order.
     */
    private List<StepDefinition> readySteps(Map<String, StepDefinition> byId, Map<String, StepState> states) {
        List<StepDefinition> ready = new ArrayList<>();
        for (StepDefinition step : byId.values()) {
            if (states.get(step.getId()).getStatus() == StepStatus.PENDING
                && step.getDependencies().stream().allMatch(dep -> isCompleted(states, dep))) {
                ready.add(step);
            }
        }
        ready.sort(Comparator.comparingInt(StepDefinition::getWeight).reversed());
        return ready;
    }

    private boolean isCompleted(Map<String, StepState> states, String stepId) {
        StepState state = states.get(stepId);
        return state != null && state.getStatus() == StepStatus.COMPLETED;
    }

    private void launch(String buildId, StepDefinition step, Map<String, StepState> states,
                        BlockingQueue<String> finished, StepListener listener) {
        StepState runningState = StepState.running(clock.instant());
        states.put(step.getId(), runningState);
        notifyListener(() -> listener.onStepStart(buildId, step));
        log.debug("Launching step {} of build {} (weight {})", step.getId(), buildId, step.getWeight());

        StepContext context = new StepContext(buildId, step.getId(),
            () -> cancellationRegistry.isCancelled(buildId));
        try {
            stepExecutor.execute(() -> runStep(buildId, step, context, runningState, states, finished, listener));
        } catch (RejectedExecutionException e) {
            log.error("Step executor rejected step {} of build {}", step.getId(), buildId, e);
            states.put(step.getId(), runningState.failed(Duration.ZERO, "step executor rejected the step"));
            finished.add(step.getId());
        }
    }

    private void runStep(String buildId, StepDefinition step, StepContext context, StepState runningState,
                         Map<String, StepState> states, BlockingQueue<String> finished, StepListener listener) {
        long startNanos = System.nanoTime();
        try {
            step.getAction().execute(context);
            Duration took = Duration.ofNanos(System.nanoTime() - startNanos);
            states.put(step.getId(), runningState.completed(took));
            log.debug("Step {} of build {} completed in {}ms", step.getId(), buildId, took.toMillis());
            notifyListener(() -> listener.onStepComplete(buildId, step, took.toMillis()));
        } catch (Throwable e) {
            // errors from step code fail the step; the tick loop must always see a terminal state
            Duration took = Duration.ofNanos(System.nanoTime() - startNanos);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            states.put(step.getId(), runningState.failed(took, message));
            log.error("Step {} of build {} failed: {}", step.getId(), buildId, message);
            notifyListener(() -> listener.onStepError(buildId, step, e));
        } finally {
            finished.add(step.getId());
        }
    }

    /**
     * Block until at least one step terminates, then drain any others that already did
     *
     * @return number of steps that terminated
     */
    private int awaitCompletion(String buildId, BlockingQueue<String> finished) {
        try {
            finished.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for steps of build " + buildId, e);
        }
        List<String> others = new ArrayList<>();
        finished.drainTo(others);
        return 1 + others.size();
    }

    private Map<String, Set<String>> blockedSteps(Map<String, StepDefinition> byId, Map<String, StepState> states) {
        Map<String, Set<String>> blocked = new LinkedHashMap<>();
        for (StepDefinition step : byId.values()) {
            if (states.get(step.getId()).getStatus() != StepStatus.PENDING) {
                continue;
            }
            Set<String> waitingOn = new LinkedHashSet<>();
            for (String dep : step.getDependencies()) {
                if (!isCompleted(states, dep)) {
                    waitingOn.add(dep);
                }
            }
            blocked.put(step.getId(), waitingOn);
        }
        return blocked;
    }

    private DagExecutionResult result(DagExecutionResult.Outcome outcome, Instant start,
                                      Map<String, StepDefinition> byId, Map<String, StepState> states,
                                      Map<String, Set<String>> blocked) {
        Map<String, StepState> ordered = new LinkedHashMap<>();
        byId.keySet().forEach(id -> ordered.put(id, states.get(id)));
        return new DagExecutionResult(outcome, Duration.between(start, clock.instant()), ordered, blocked);
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Step listener failed: {}", e.getMessage(), e);
        }
    }
}

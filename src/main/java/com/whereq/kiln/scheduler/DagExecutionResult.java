package com.whereq.kiln.scheduler;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of executing one step DAG
 */
@Getter
@AllArgsConstructor
public class DagExecutionResult {

    public enum Outcome {
        /**
         * Every step completed
         */
        SUCCEEDED,

        /**
         * Every step terminated but at least one failed
         */
        FAILED,

        /**
         * Pending steps remain that can never become ready
         */
        DEADLOCKED
    }

    private final Outcome outcome;

    private final Duration totalDuration;

    /**
     * Final state per step id, in declaration order
     */
    private final Map<String, StepState> stepResults;

    /**
     * For a deadlock: each stuck step and the dependencies it still waits on
     */
    private final Map<String, Set<String>> blockedSteps;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    public boolean isDeadlocked() {
        return outcome == Outcome.DEADLOCKED;
    }

    /**
     * Human-readable explanation of a non-successful run
     */
    public String diagnostic() {
        if (isSuccess()) {
            return "all steps completed";
        }
        String failures = stepResults.entrySet().stream()
            .filter(e -> e.getValue().getStatus() == StepStatus.FAILED)
            .map(e -> e.getKey() + " (" + e.getValue().getError() + ")")
            .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        if (!failures.isEmpty()) {
            sb.append("failed steps: ").append(failures);
        }
        if (isDeadlocked()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("deadlock, unreachable steps: ");
            sb.append(blockedSteps.entrySet().stream()
                .map(e -> e.getKey() + " waits on " + describe(e.getValue()))
                .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    private String describe(Set<String> dependencies) {
        return dependencies.stream()
            .map(dep -> {
                StepState state = stepResults.get(dep);
                return dep + "[" + (state == null ? "MISSING" : state.getStatus().name()) + "]";
            })
            .collect(Collectors.joining(" "));
    }
}

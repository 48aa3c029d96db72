package com.whereq.kiln.scheduler;

import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node of a build's execution DAG
 */
@Getter
@ToString(exclude = "action")
public class StepDefinition {

    private final String id;

    private final String name;

    private final Set<String> dependencies;

    /**
     * Scheduling hint, heavier steps are launched first
     */
    private final int weight;

    private final BuildStep action;

    public StepDefinition(String id, String name, Collection<String> dependencies, int weight, BuildStep action) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be blank");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("Step " + id + " weight must be positive, got " + weight);
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.dependencies = Set.copyOf(new LinkedHashSet<>(dependencies));
        this.weight = weight;
        this.action = Objects.requireNonNull(action, "action");
    }

    public static StepDefinition of(String id, BuildStep action, String... dependencies) {
        return new StepDefinition(id, id, Arrays.asList(dependencies), 1, action);
    }

    public StepDefinition withWeight(int newWeight) {
        return new StepDefinition(id, name, dependencies, newWeight, action);
    }

    public StepDefinition withName(String newName) {
        return new StepDefinition(id, newName, dependencies, weight, action);
    }
}

package com.whereq.kiln.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tenant service class. Determines queue priority (lower value dequeued first)
 * and the resource limits handed to step implementations.
 */
public enum Tier {
    PREMIUM(1),
    STANDARD(5),
    FREE(10);

    private final int priority;

    Tier(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Resolve a tier name, defaulting to {@link #FREE} when absent or unknown
     */
    @JsonCreator
    public static Tier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        try {
            return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.whereq.kiln.model;

/**
 * Terminal build events emitted to notification consumers
 */
public enum BuildEventType {
    COMPLETED,
    FAILED,
    CANCELLED,
    DEAD_LETTERED
}

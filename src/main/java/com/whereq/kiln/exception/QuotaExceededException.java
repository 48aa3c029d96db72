package com.whereq.kiln.exception;

/**
 * Exception thrown when a tenant already has its quota of pending builds,
 * or the global backlog is full
 */
public class QuotaExceededException extends RuntimeException {

    private final String tenantKey;

    public QuotaExceededException(String message) {
        this(message, null);
    }

    public QuotaExceededException(String message, String tenantKey) {
        super(message);
        this.tenantKey = tenantKey;
    }

    public String getTenantKey() {
        return tenantKey;
    }
}

package com.whereq.kiln.exception;

import java.util.List;

/**
 * Exception thrown when a build specification fails validation at admission
 */
public class InvalidSpecException extends RuntimeException {

    private final List<String> violations;

    public InvalidSpecException(List<String> violations) {
        super("Invalid build spec: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}

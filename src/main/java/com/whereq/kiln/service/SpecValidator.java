package com.whereq.kiln.service;

import com.whereq.kiln.dto.BuildSubmitRequest;
import com.whereq.kiln.exception.InvalidSpecException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Schema check of a submission, run before anything enters the queue
 */
@Component
public class SpecValidator {

    private final Validator validator;

    public SpecValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws InvalidSpecException listing every violation, sorted by property path
     */
    public void validate(BuildSubmitRequest request) {
        if (request == null) {
            throw new InvalidSpecException(List.of("request: must not be null"));
        }
        Set<ConstraintViolation<BuildSubmitRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new InvalidSpecException(violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList());
        }
    }
}

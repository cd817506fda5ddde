package com.project.agro.analysis.service;

import com.project.agro.analysis.exceptions.InvalidInputException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejects out-of-range caller parameters before any computation starts. Values are never
 * clamped here.
 */
@Component
public class ParameterValidator {
    private static final Logger log = LoggerFactory.getLogger(ParameterValidator.class);

    private final Validator validator;

    public ParameterValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> T validate(T parameters) {
        if (parameters == null) {
            throw new InvalidInputException("Parameters are missing");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(parameters);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
            log.warn("Rejected {}: {}", parameters.getClass().getSimpleName(), messages);
            throw new InvalidInputException("Invalid " + parameters.getClass().getSimpleName() + ": "
                    + String.join("; ", messages), messages);
        }
        return parameters;
    }

    public double requireRange(String name, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new InvalidInputException(name + " must be within [" + min + ", " + max + "] (got " + value + ")");
        }
        return value;
    }

    public long requireRange(String name, long value, long min, long max) {
        if (value < min || value > max) {
            throw new InvalidInputException(name + " must be within [" + min + ", " + max + "] (got " + value + ")");
        }
        return value;
    }
}

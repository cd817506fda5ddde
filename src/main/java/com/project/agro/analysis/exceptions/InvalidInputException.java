package com.project.agro.analysis.exceptions;

import java.util.List;

/**
 * Malformed buffer or out-of-range caller parameter. Raised before anything is computed;
 * a service layer maps it to a client error.
 */
public class InvalidInputException extends AnalysisException {
    private final List<String> violations;

    public InvalidInputException(String message) {
        this(message, List.of(message));
    }

    public InvalidInputException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}

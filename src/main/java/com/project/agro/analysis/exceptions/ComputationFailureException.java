package com.project.agro.analysis.exceptions;

/**
 * A numerical result the engine could not produce (NaN, infinity). Treated as a defect,
 * never retried and never recovered from inside the engine.
 */
public class ComputationFailureException extends AnalysisException {
    public ComputationFailureException(String message) { super(message); }
    public ComputationFailureException(String message, Throwable cause) { super(message, cause); }
}

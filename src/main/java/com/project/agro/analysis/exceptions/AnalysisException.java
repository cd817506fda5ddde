package com.project.agro.analysis.exceptions;

/** Root of the engine's error taxonomy. */
public class AnalysisException extends RuntimeException {
    public AnalysisException(String message) { super(message); }
    public AnalysisException(String message, Throwable cause) { super(message, cause); }
}

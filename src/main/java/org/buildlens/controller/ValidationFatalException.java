package org.buildlens.controller;

/**
 * Orchestrator-level failure that aborts a validation run.
 */
public class ValidationFatalException extends RuntimeException {
    public ValidationFatalException(String message) {
        super(message);
    }

    public ValidationFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}

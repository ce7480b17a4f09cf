package org.buildlens.controller;

/**
 * Signals a second concurrent {@code run()} on the same controller instance.
 */
public final class AlreadyRunningException extends ValidationFatalException {
    public AlreadyRunningException() {
        super("validation is already running");
    }
}

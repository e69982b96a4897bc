package com.smartlists.ruleengine.api.exceptions;

/**
 * Thrown when the caller's cancellation signal fired during a run.
 */
public class RunCancelledException extends EvaluationRunException {

    public RunCancelledException(String message) {
        super(Reason.CANCELLED, message);
    }

    public RunCancelledException(String message, Throwable cause) {
        super(Reason.CANCELLED, message, cause);
    }
}

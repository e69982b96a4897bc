package com.smartlists.ruleengine.api.exceptions;

import java.util.Objects;

/**
 * Run-level failure of a list evaluation.
 *
 * <p>When this is thrown no partial result exists: callers treat the run as aborted
 * and must not materialize anything from it.
 */
public class EvaluationRunException extends RuntimeException {

    /**
     * Why the run was aborted.
     */
    public enum Reason {
        /** Cancellation was requested between two batches. */
        CANCELLED,
        /** The candidate source returned fewer items than it announced. */
        SOURCE_EXHAUSTED,
        /** The candidate source itself failed. */
        SOURCE_FAILURE,
        /** Worker pool, host callback or other unexpected failure. */
        RESOURCE_FAILURE
    }

    private final Reason reason;

    public EvaluationRunException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public EvaluationRunException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason getReason() {
        return reason;
    }
}

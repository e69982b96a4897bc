package com.smartlists.ruleengine.api;

/**
 * Cooperative cancellation, checked between candidate batches.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();
}

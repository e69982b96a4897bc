package com.smartlists.ruleengine.api;

/**
 * Receives progress after each processed candidate batch.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = (processed, total) -> { };

    void onBatchProcessed(long processed, long total);
}

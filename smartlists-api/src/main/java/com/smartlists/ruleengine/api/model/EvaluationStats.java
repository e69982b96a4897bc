package com.smartlists.ruleengine.api.model;

/**
 * Counters describing one run.
 *
 * @param candidates       items pulled from the candidate source
 * @param eligible         items left after media type and extras filtering
 * @param phase1Survivors  items that needed expensive evaluation (equals eligible for single-phase runs)
 * @param matched          items matching at least one expression set
 * @param returned         items in the final list
 * @param twoPhase         whether expensive fields triggered two-phase filtering
 * @param elapsedNanos     wall time of the run
 */
public record EvaluationStats(
        long candidates,
        long eligible,
        long phase1Survivors,
        long matched,
        long returned,
        boolean twoPhase,
        long elapsedNanos
) {
}

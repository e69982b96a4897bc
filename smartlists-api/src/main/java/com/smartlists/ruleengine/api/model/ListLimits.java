package com.smartlists.ruleengine.api.model;

/**
 * Size bounds of a list.
 *
 * @param perGroupMax        default limit for expression sets without their own; null = none
 * @param globalMax          limit after merging groups; null or non-positive = none
 * @param playtimeCapMinutes total runtime cap; null or non-positive = none
 */
public record ListLimits(Integer perGroupMax, Integer globalMax, Integer playtimeCapMinutes) {

    public static ListLimits unlimited() {
        return new ListLimits(null, null, null);
    }

    public static ListLimits ofMaxItems(int globalMax) {
        return new ListLimits(null, globalMax, null);
    }

    public boolean hasPerGroupMax() {
        return perGroupMax != null && perGroupMax > 0;
    }

    public boolean hasGlobalMax() {
        return globalMax != null && globalMax > 0;
    }

    public boolean hasPlaytimeCap() {
        return playtimeCapMinutes != null && playtimeCapMinutes > 0;
    }
}

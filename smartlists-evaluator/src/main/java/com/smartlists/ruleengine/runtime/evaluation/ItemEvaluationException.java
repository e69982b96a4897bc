package com.smartlists.ruleengine.runtime.evaluation;

/**
 * Failure confined to a single candidate item.
 *
 * <p>Raised by value extraction, host lookups and bounded regex matching. The pipeline
 * catches it, excludes the item and counts the failure; it never reaches the caller.
 */
public class ItemEvaluationException extends RuntimeException {

    private final String itemId;

    public ItemEvaluationException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public ItemEvaluationException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    /**
     * @return the failing item, or null when raised outside an item context
     */
    public String getItemId() {
        return itemId;
    }
}

package com.smartlists.ruleengine.api.exceptions;

/**
 * Exception thrown when a smart list definition cannot be compiled.
 *
 * <p>Covers unknown fields, operators not allowed for a field, malformed target
 * values, invalid regular expressions and options out of range. It is raised before
 * any candidate item is processed, so a run never starts with a broken definition.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the codebase.
 */
public class RuleDefinitionException extends RuntimeException {

    public RuleDefinitionException(String message) {
        super(message);
    }

    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

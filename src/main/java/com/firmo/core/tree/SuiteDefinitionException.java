package com.firmo.core.tree;

/**
 * Raised, when the case is run, by the placeholder case recorded for a suite whose body threw
 * while declaring its children.
 */
public class SuiteDefinitionException extends RuntimeException {
    public SuiteDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

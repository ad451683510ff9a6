package com.firmo.core.expect;

/**
 * Thrown when an assertion itself is malformed (null pattern, negative tolerance, wrong subject
 * type for the matcher). It is never intercepted as a failure of the code under test.
 */
public class ExpectationUsageException extends RuntimeException {
    public ExpectationUsageException(String message) {
        super(message);
    }
}

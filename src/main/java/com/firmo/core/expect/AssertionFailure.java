package com.firmo.core.expect;

/**
 * Raised by an expectation whose matcher result disagrees with the requested polarity.
 * <p>
 * Carries the rendered expected/actual values and the structural diff so that a reporter can
 * show them without re-deriving anything.
 */
public class AssertionFailure extends AssertionError {

    private final String explanation;
    private final String expected;
    private final String actual;
    private final String diff;
    private final String chain;
    private final String customMessage;

    public AssertionFailure(String explanation, String expected, String actual, String diff,
                            String chain, String customMessage) {
        super(customMessage == null ? explanation : explanation + " - " + customMessage);
        this.explanation = explanation;
        this.expected = expected;
        this.actual = actual;
        this.diff = diff;
        this.chain = chain;
        this.customMessage = customMessage;
    }

    /** Matcher explanation without the custom message. */
    public String getExplanation() {
        return explanation;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public String getDiff() {
        return diff;
    }

    /** Qualifier chain that selected the matcher, e.g. {@code "not.to.contain.key"}. */
    public String getChain() {
        return chain;
    }

    public String getCustomMessage() {
        return customMessage;
    }
}

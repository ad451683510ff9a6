package com.firmo.core.matcher;

/**
 * Outcome of evaluating one matcher predicate.
 * <p>
 * Matchers never throw: a subject or expected value they cannot interpret yields
 * {@code matched == false} with an explanation instead.
 *
 * @param matched        whether the predicate held
 * @param message        explanation used when a positive assertion fails ("expected X to equal Y")
 * @param negatedMessage explanation used when a negated assertion fails ("expected X to not equal Y")
 * @param expected       rendering of the expected side, may be null
 * @param actual         rendering of the actual side, may be null
 * @param diff           structural difference description, may be null
 */
public record MatchResult(
    boolean matched,
    String message,
    String negatedMessage,
    String expected,
    String actual,
    String diff
) {

    public static MatchResult of(boolean matched, String message, String negatedMessage) {
        return new MatchResult(matched, message, negatedMessage, null, null, null);
    }

    /**
     * A non-match caused by input the matcher could not interpret. The explanation is
     * reported whether or not the assertion was negated.
     */
    public static MatchResult uninterpretable(String explanation) {
        return new MatchResult(false, explanation, explanation, null, null, null);
    }

    public MatchResult withValues(Object expectedValue, Object actualValue) {
        return new MatchResult(matched, message, negatedMessage,
                ValueFormatter.format(expectedValue), ValueFormatter.format(actualValue), diff);
    }

    public MatchResult withDiff(String difference) {
        return new MatchResult(matched, message, negatedMessage, expected, actual, difference);
    }

    /** The explanation relevant to an assertion made with the given polarity. */
    public String explanation(boolean negated) {
        return negated ? negatedMessage : message;
    }
}

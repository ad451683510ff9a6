package com.firmo.core.expect;

import com.firmo.core.config.FirmoSettings;
import com.firmo.core.matcher.ContainmentMatchers;
import com.firmo.core.matcher.DateMatchers;
import com.firmo.core.matcher.DeepEquality;
import com.firmo.core.matcher.FailureMatchers;
import com.firmo.core.matcher.MatchResult;
import com.firmo.core.matcher.NumericMatchers;
import com.firmo.core.matcher.PatternMatchers;
import com.firmo.core.matcher.PatternOptions;
import com.firmo.core.matcher.ThrowingRunnable;
import com.firmo.core.matcher.TypeMatchers;
import com.firmo.core.matcher.ValueFormatter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Fluent assertion over one subject value.
 * <p>
 * Qualifiers ({@link #not()}, {@link #to()}, {@link #contain()}, {@link #match()}) return new
 * immutable expectations and never evaluate anything. Terminal methods run the selected
 * matcher and raise {@link AssertionFailure} when the outcome disagrees with the polarity.
 * Malformed terminal arguments raise {@link ExpectationUsageException}.
 *
 * @param <T> subject type
 */
public final class Expectation<T> {

    private final T subject;
    private final boolean negated;
    private final List<String> chain;
    private final String customMessage;
    private final FirmoSettings settings;

    Expectation(T subject, FirmoSettings settings) {
        this(subject, false, List.of(), null, settings);
    }

    private Expectation(T subject, boolean negated, List<String> chain, String customMessage,
                        FirmoSettings settings) {
        this.subject = subject;
        this.negated = negated;
        this.chain = chain;
        this.customMessage = customMessage;
        this.settings = settings;
    }

    public T subject() {
        return subject;
    }

    public boolean isNegated() {
        return negated;
    }

    // -- qualifiers

    public Expectation<T> not() {
        return new Expectation<>(subject, !negated, append(chain, "not"), customMessage, settings);
    }

    /** Readability only. */
    public Expectation<T> to() {
        return new Expectation<>(subject, negated, append(chain, "to"), customMessage, settings);
    }

    /** Appends {@code message} to the failure explanation. */
    public Expectation<T> describedAs(String message) {
        return new Expectation<>(subject, negated, chain, message, settings);
    }

    public ContainQualifier contain() {
        return new ContainQualifier(append(chain, "contain"));
    }

    public MatchQualifier match() {
        return new MatchQualifier(append(chain, "match"), PatternOptions.none());
    }

    // -- equality and identity

    public void toEqual(Object expected) {
        verify("equal", DeepEquality.equal(subject, expected));
    }

    /** Deep equality where numbers may differ by at most {@code epsilon}. */
    public void toEqual(Object expected, double epsilon) {
        requireTolerance(epsilon);
        verify("equal", DeepEquality.equal(subject, expected, epsilon));
    }

    /** Reference identity, or value equality for numbers, strings and booleans. */
    public void toBe(Object expected) {
        boolean same = subject == expected
                || (isScalar(subject) && isScalar(expected) && DeepEquality.deepEquals(subject, expected));
        String a = ValueFormatter.format(subject);
        String e = ValueFormatter.format(expected);
        verify("be", MatchResult.of(same, "expected " + a + " to be " + e, "expected " + a + " to not be " + e)
                .withValues(expected, subject));
    }

    // -- numbers and ordering

    public void toBeNear(Number expected) {
        toBeNear(expected, settings.tolerance());
    }

    public void toBeNear(Number expected, double tolerance) {
        requireNonNull(expected, "expected value");
        requireTolerance(tolerance);
        verify("be_near", NumericMatchers.near(subject, expected, tolerance));
    }

    public void toBeApproximately(Number expected) {
        toBeNear(expected);
    }

    public void toBeApproximately(Number expected, double tolerance) {
        toBeNear(expected, tolerance);
    }

    public void toBeBetween(Object min, Object max) {
        requireNonNull(min, "lower bound");
        requireNonNull(max, "upper bound");
        verify("be_between", NumericMatchers.between(subject, min, max));
    }

    public void toBeGreaterThan(Object bound) {
        requireNonNull(bound, "bound");
        verify("be_greater_than", NumericMatchers.greaterThan(subject, bound));
    }

    public void toBeLessThan(Object bound) {
        requireNonNull(bound, "bound");
        verify("be_less_than", NumericMatchers.lessThan(subject, bound));
    }

    public void toBeAtLeast(Object bound) {
        requireNonNull(bound, "bound");
        verify("be_at_least", NumericMatchers.atLeast(subject, bound));
    }

    public void toBeAtMost(Object bound) {
        requireNonNull(bound, "bound");
        verify("be_at_most", NumericMatchers.atMost(subject, bound));
    }

    public void toBeInteger() {
        verify("be_integer", NumericMatchers.integer(subject));
    }

    public void toBePositive() {
        verify("be_positive", NumericMatchers.positive(subject));
    }

    public void toBeNegative() {
        verify("be_negative", NumericMatchers.negative(subject));
    }

    // -- strings

    public void toMatch(String regex) {
        match().pattern(regex);
    }

    public void toMatch(String regex, PatternOptions options) {
        match().withOptions(options).pattern(regex);
    }

    public void toStartWith(String prefix) {
        requireNonNull(prefix, "prefix");
        verify("start_with", PatternMatchers.startsWith(subject, prefix));
    }

    public void toEndWith(String suffix) {
        requireNonNull(suffix, "suffix");
        verify("end_with", PatternMatchers.endsWith(subject, suffix));
    }

    public void toBeUppercase() {
        verify("be_uppercase", PatternMatchers.uppercase(subject));
    }

    public void toBeLowercase() {
        verify("be_lowercase", PatternMatchers.lowercase(subject));
    }

    // -- containers

    public void toContain(Object element) {
        contain().value(element);
    }

    public void toHaveLength(int length) {
        if (length < 0) {
            throw new ExpectationUsageException("length must not be negative: " + length);
        }
        verify("have_length", ContainmentMatchers.hasLength(subject, length));
    }

    public void toHaveProperty(String name) {
        requireNonNull(name, "property name");
        verify("have_property", ContainmentMatchers.hasProperty(subject, name, false, null));
    }

    public void toHaveProperty(String name, Object value) {
        requireNonNull(name, "property name");
        verify("have_property", ContainmentMatchers.hasProperty(subject, name, true, value));
    }

    public void toBeSubsetOf(Object superset) {
        requireNonNull(superset, "superset");
        verify("be_subset_of", ContainmentMatchers.isSubsetOf(subject, superset));
    }

    // -- dates

    public void toBeDate() {
        verify("be_date", DateMatchers.isDate(subject));
    }

    public void toBeIsoDate() {
        verify("be_iso_date", DateMatchers.isIsoDate(subject));
    }

    public void toBeBefore(Object other) {
        requireNonNull(other, "date");
        verify("be_before", DateMatchers.before(subject, other));
    }

    public void toBeAfter(Object other) {
        requireNonNull(other, "date");
        verify("be_after", DateMatchers.after(subject, other));
    }

    public void toBeSameDayAs(Object other) {
        requireNonNull(other, "date");
        verify("be_same_day_as", DateMatchers.sameDay(subject, other));
    }

    public void toBeBetweenDates(Object start, Object end) {
        toBeBetweenDates(start, end, true);
    }

    public void toBeBetweenDates(Object start, Object end, boolean inclusive) {
        requireNonNull(start, "start date");
        requireNonNull(end, "end date");
        verify("be_between_dates", DateMatchers.betweenDates(subject, start, end, inclusive));
    }

    // -- types and truthiness

    public void toBeCallable() {
        verify("be_callable", TypeMatchers.callable(subject));
    }

    public void toBeComparable() {
        verify("be_comparable", TypeMatchers.comparable(subject));
    }

    public void toBeIterable() {
        verify("be_iterable", TypeMatchers.iterable(subject));
    }

    public void toBeA(Class<?> type) {
        requireNonNull(type, "type");
        verify("be_a", TypeMatchers.instanceOf(subject, type));
    }

    public void toBeNull() {
        verify("be_nil", TypeMatchers.isNull(subject));
    }

    public void toExist() {
        verify("exist", TypeMatchers.exists(subject));
    }

    public void toBeTruthy() {
        verify("be_truthy", TypeMatchers.truthy(subject));
    }

    public void toBeFalsy() {
        verify("be_falsy", TypeMatchers.falsy(subject));
    }

    public void toSatisfy(Predicate<? super T> predicate) {
        requireNonNull(predicate, "predicate");
        verify("satisfy", TypeMatchers.satisfies(subject, predicate));
    }

    // -- failures; the subject must be a ThrowingRunnable

    public void toFail() {
        verify("fail", FailureMatchers.fails(block()));
    }

    public void toFailWith(String regex) {
        requireNonNull(regex, "pattern");
        verify("fail.with", FailureMatchers.failsWith(block(), regex));
    }

    public void toThrow(Class<? extends Throwable> type) {
        requireNonNull(type, "exception type");
        verify("throw", FailureMatchers.throwsType(block(), type));
    }

    /**
     * Key and membership checks selected by {@code contain()}.
     */
    public final class ContainQualifier {

        private final List<String> path;

        private ContainQualifier(List<String> path) {
            this.path = path;
        }

        public void value(Object element) {
            verify(path, "value", ContainmentMatchers.contains(subject, element));
        }

        public void key(Object key) {
            requireNonNull(key, "key");
            verify(path, "key", ContainmentMatchers.hasKey(subject, key));
        }

        public void keys(Object... keys) {
            requireNonEmpty(keys, "keys");
            verify(path, "keys", ContainmentMatchers.hasKeys(subject, Arrays.asList(keys)));
        }

        /** Dotted path such as {@code "nested.value"}. */
        public void deepKey(String dottedPath) {
            requireNonNull(dottedPath, "key path");
            if (dottedPath.isEmpty()) {
                throw new ExpectationUsageException("key path must not be empty");
            }
            verify(path, "deep_key", ContainmentMatchers.hasDeepKey(subject, dottedPath));
        }

        public void deepKey(List<?> segments) {
            requireNonNull(segments, "key path");
            if (segments.isEmpty()) {
                throw new ExpectationUsageException("key path must not be empty");
            }
            if (segments.stream().anyMatch(Objects::isNull)) {
                throw new ExpectationUsageException("key path must not contain null");
            }
            verify(path, "deep_key", ContainmentMatchers.hasDeepKey(subject, segments));
        }

        public void exactKeys(Object... keys) {
            requireNonNull(keys, "keys");
            verify(path, "exact_keys", ContainmentMatchers.hasExactKeys(subject, Arrays.asList(keys)));
        }
    }

    /**
     * Regular-expression checks selected by {@code match()}. Options accumulate until a
     * terminal method is called.
     */
    public final class MatchQualifier {

        private final List<String> path;
        private final PatternOptions options;

        private MatchQualifier(List<String> path, PatternOptions options) {
            this.path = path;
            this.options = options;
        }

        public MatchQualifier caseInsensitive() {
            return new MatchQualifier(path, options.withCaseInsensitive());
        }

        public MatchQualifier multiline() {
            return new MatchQualifier(path, options.withMultiline());
        }

        public MatchQualifier global() {
            return new MatchQualifier(path, options.withGlobal());
        }

        public MatchQualifier withOptions(PatternOptions patternOptions) {
            requireNonNull(patternOptions, "pattern options");
            return new MatchQualifier(append(path, "with_options"), patternOptions);
        }

        public void pattern(String regex) {
            requireNonNull(regex, "pattern");
            verify(path, null, PatternMatchers.matches(subject, regex, checked(options)));
        }

        public void fully(String regex) {
            requireNonNull(regex, "pattern");
            verify(path, "fully", PatternMatchers.matches(subject, regex, checked(options.withFully())));
        }

        public void anyOf(String... patterns) {
            requireNonEmpty(patterns, "patterns");
            verify(path, "any_of", PatternMatchers.matchesAnyOf(subject, List.of(patterns), checked(options)));
        }

        public void allOf(String... patterns) {
            requireNonEmpty(patterns, "patterns");
            verify(path, "all_of", PatternMatchers.matchesAllOf(subject, List.of(patterns), checked(options)));
        }

        private PatternOptions checked(PatternOptions o) {
            if (o.global() && o.fully()) {
                throw new ExpectationUsageException("pattern options 'global' and 'fully' cannot be combined");
            }
            return o;
        }
    }

    private void verify(String matcher, MatchResult result) {
        verify(chain, matcher, result);
    }

    private void verify(List<String> path, String matcher, MatchResult result) {
        if (result.matched() != negated) {
            return;
        }
        List<String> full = matcher == null ? path : append(path, matcher);
        throw new AssertionFailure(result.explanation(negated), result.expected(), result.actual(),
                result.diff(), String.join(".", full), customMessage);
    }

    private ThrowingRunnable block() {
        if (subject instanceof ThrowingRunnable r) {
            return r;
        }
        if (subject instanceof Runnable r) {
            return r::run;
        }
        throw new ExpectationUsageException("failure matchers need a ThrowingRunnable subject, got "
                + ValueFormatter.typeName(subject));
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof CharSequence
                || value instanceof Boolean || value instanceof Character || value instanceof Enum<?>;
    }

    private static void requireTolerance(double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new ExpectationUsageException("tolerance must be a non-negative number, got " + tolerance);
        }
    }

    private static void requireNonNull(Object argument, String what) {
        if (argument == null) {
            throw new ExpectationUsageException(what + " must not be null");
        }
    }

    private static void requireNonEmpty(Object[] arguments, String what) {
        if (arguments == null || arguments.length == 0) {
            throw new ExpectationUsageException(what + " must not be empty");
        }
        for (Object a : arguments) {
            if (a == null) throw new ExpectationUsageException(what + " must not contain null");
        }
    }

    private static List<String> append(List<String> chain, String element) {
        var copy = new ArrayList<String>(chain.size() + 1);
        copy.addAll(chain);
        copy.add(element);
        return Collections.unmodifiableList(copy);
    }
}

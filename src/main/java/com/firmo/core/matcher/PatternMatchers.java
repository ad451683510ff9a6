package com.firmo.core.matcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * String predicates: literal substring, prefix/suffix, regular expressions with options,
 * and any-of/all-of over several patterns.
 */
public final class PatternMatchers {

    private PatternMatchers() {}

    public static MatchResult containsText(Object actual, String fragment) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        return MatchResult.of(s.toString().contains(fragment),
                "expected " + quote(s) + " to contain " + quote(fragment),
                "expected " + quote(s) + " to not contain " + quote(fragment));
    }

    public static MatchResult startsWith(Object actual, String prefix) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        return MatchResult.of(s.toString().startsWith(prefix),
                "expected " + quote(s) + " to start with " + quote(prefix),
                "expected " + quote(s) + " to not start with " + quote(prefix));
    }

    public static MatchResult endsWith(Object actual, String suffix) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        return MatchResult.of(s.toString().endsWith(suffix),
                "expected " + quote(s) + " to end with " + quote(suffix),
                "expected " + quote(s) + " to not end with " + quote(suffix));
    }

    public static MatchResult matches(Object actual, String regex) {
        return matches(actual, regex, PatternOptions.none());
    }

    /**
     * Regular-expression match. Without {@code fully} the pattern may match anywhere in the
     * input; with {@code multiline} anchors apply per line. A pattern that does not compile
     * is reported as a non-match.
     */
    public static MatchResult matches(Object actual, String regex, PatternOptions options) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, options.flags());
        } catch (PatternSyntaxException e) {
            return MatchResult.uninterpretable("invalid pattern " + quote(regex) + ": " + e.getDescription());
        }
        Matcher m = pattern.matcher(s);
        boolean matched;
        String detail = "";
        if (options.fully()) {
            matched = m.matches();
        } else if (options.global()) {
            int count = 0;
            while (m.find()) count++;
            matched = count > 0;
            detail = " (" + count + " occurrence" + (count == 1 ? "" : "s") + ")";
        } else {
            matched = m.find();
        }
        String verb = options.fully() ? "fully match" : "match";
        String suffix = options.describe();
        return MatchResult.of(matched,
                "expected " + quote(s) + " to " + verb + " pattern " + quote(regex) + suffix,
                "expected " + quote(s) + " to not " + verb + " pattern " + quote(regex) + suffix + detail);
    }

    public static MatchResult matchesFully(Object actual, String regex) {
        return matches(actual, regex, PatternOptions.none().withFully());
    }

    /** OR semantics: at least one pattern matches. */
    public static MatchResult matchesAnyOf(Object actual, List<String> patterns, PatternOptions options) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        var invalid = new ArrayList<String>();
        for (String p : patterns) {
            MatchResult r = matches(s, p, options);
            if (r.matched()) {
                return MatchResult.of(true,
                        "expected " + quote(s) + " to match any of " + ValueFormatter.format(patterns),
                        "expected " + quote(s) + " to not match any of " + ValueFormatter.format(patterns)
                                + " but it matched " + quote(p));
            }
            if (r.message().startsWith("invalid pattern")) invalid.add(r.message());
        }
        String extra = invalid.isEmpty() ? "" : " (" + String.join("; ", invalid) + ")";
        return MatchResult.of(false,
                "expected " + quote(s) + " to match any of " + ValueFormatter.format(patterns) + extra,
                "expected " + quote(s) + " to not match any of " + ValueFormatter.format(patterns));
    }

    /** AND semantics: every pattern matches. */
    public static MatchResult matchesAllOf(Object actual, List<String> patterns, PatternOptions options) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        for (String p : patterns) {
            MatchResult r = matches(s, p, options);
            if (!r.matched()) {
                return MatchResult.of(false,
                        "expected " + quote(s) + " to match all of " + ValueFormatter.format(patterns)
                                + " but it did not match " + quote(p),
                        "expected " + quote(s) + " to not match all of " + ValueFormatter.format(patterns));
            }
        }
        return MatchResult.of(true,
                "expected " + quote(s) + " to match all of " + ValueFormatter.format(patterns),
                "expected " + quote(s) + " to not match all of " + ValueFormatter.format(patterns));
    }

    public static MatchResult uppercase(Object actual) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        String str = s.toString();
        return MatchResult.of(str.equals(str.toUpperCase(Locale.ROOT)),
                "expected " + quote(s) + " to be uppercase",
                "expected " + quote(s) + " to not be uppercase");
    }

    public static MatchResult lowercase(Object actual) {
        if (!(actual instanceof CharSequence s)) {
            return notAString(actual);
        }
        String str = s.toString();
        return MatchResult.of(str.equals(str.toLowerCase(Locale.ROOT)),
                "expected " + quote(s) + " to be lowercase",
                "expected " + quote(s) + " to not be lowercase");
    }

    private static MatchResult notAString(Object actual) {
        return MatchResult.uninterpretable("expected a string, got " + ValueFormatter.typeName(actual));
    }

    private static String quote(CharSequence s) {
        return "\"" + s + "\"";
    }
}

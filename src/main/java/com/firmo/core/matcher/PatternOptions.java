package com.firmo.core.matcher;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags for regular-expression matching.
 *
 * @param caseInsensitive ignore case (Unicode aware)
 * @param multiline       {@code ^} and {@code $} anchor at every line
 * @param global          count every occurrence instead of stopping at the first
 * @param fully           the whole input must match, as if anchored at both ends
 */
public record PatternOptions(boolean caseInsensitive, boolean multiline, boolean global, boolean fully) {

    private static final PatternOptions NONE = new PatternOptions(false, false, false, false);

    public static PatternOptions none() {
        return NONE;
    }

    public PatternOptions withCaseInsensitive() {
        return new PatternOptions(true, multiline, global, fully);
    }

    public PatternOptions withMultiline() {
        return new PatternOptions(caseInsensitive, true, global, fully);
    }

    public PatternOptions withGlobal() {
        return new PatternOptions(caseInsensitive, multiline, true, fully);
    }

    public PatternOptions withFully() {
        return new PatternOptions(caseInsensitive, multiline, global, true);
    }

    int flags() {
        int flags = 0;
        if (caseInsensitive) flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        if (multiline) flags |= Pattern.MULTILINE;
        return flags;
    }

    /** Suffix for failure messages, empty when no option is set. */
    String describe() {
        List<String> names = new ArrayList<>();
        if (caseInsensitive) names.add("case_insensitive");
        if (multiline) names.add("multiline");
        if (global) names.add("global");
        if (fully) names.add("fully");
        return names.isEmpty() ? "" : " (with options: " + String.join(", ", names) + ")";
    }
}

package com.firmo.core.plan;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Optional run-time narrowing applied after focus and exclusion.
 *
 * @param onlyTags    when non-empty, a case runs only if it carries at least one of these tags
 * @param namePattern when non-null, a case runs only if its name contains a match
 */
public record RunFilter(Set<String> onlyTags, Pattern namePattern) {

    private static final RunFilter NONE = new RunFilter(Set.of(), null);

    public RunFilter {
        onlyTags = onlyTags == null ? Set.of() : Set.copyOf(onlyTags);
    }

    public static RunFilter none() {
        return NONE;
    }

    public static RunFilter of(Set<String> onlyTags, String namePattern) {
        return new RunFilter(onlyTags, namePattern == null || namePattern.isEmpty() ? null : Pattern.compile(namePattern));
    }

    public boolean isEmpty() {
        return onlyTags.isEmpty() && namePattern == null;
    }
}

package com.firmo.core.tree;

/**
 * Declaration marker controlling which part of the tree executes.
 */
public enum FocusState {
    NORMAL,
    /** Declared with {@code fdescribe}/{@code fit}. */
    FOCUSED,
    /** Declared with {@code xdescribe}/{@code xit}; overrides focus at any depth. */
    EXCLUDED
}

package com.firmo.core.tree;

/**
 * Declares the children of a suite. Evaluated once, synchronously, while the tree is built.
 */
@FunctionalInterface
public interface SuiteBody {
    void declare(TestDsl dsl) throws Exception;
}

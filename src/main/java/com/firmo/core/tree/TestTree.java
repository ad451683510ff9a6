package com.firmo.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A built, read-only test tree under a synthetic unnamed root suite.
 */
public final class TestTree {

    private final TestNode root;

    TestTree(TestNode root) {
        this.root = root;
    }

    public TestNode root() {
        return root;
    }

    /** Every node except the root, depth-first in declaration order. */
    public List<TestNode> nodes() {
        var out = new ArrayList<TestNode>();
        collect(root, out, false);
        return out;
    }

    /** Every case, depth-first in declaration order. */
    public List<TestNode> cases() {
        var out = new ArrayList<TestNode>();
        collect(root, out, true);
        return out;
    }

    /**
     * Looks a node up by its names from the top level down, e.g. {@code find("A", "B", "Case1")}.
     */
    public Optional<TestNode> find(String... path) {
        TestNode current = root;
        for (String segment : path) {
            TestNode next = null;
            for (TestNode child : current.children()) {
                if (child.name().equals(segment)) {
                    next = child;
                    break;
                }
            }
            if (next == null) return Optional.empty();
            current = next;
        }
        return current == root ? Optional.empty() : Optional.of(current);
    }

    private static void collect(TestNode node, List<TestNode> out, boolean casesOnly) {
        for (TestNode child : node.children()) {
            if (!casesOnly || child.isCase()) out.add(child);
            if (child.isSuite()) collect(child, out, casesOnly);
        }
    }
}

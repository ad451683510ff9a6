package com.firmo.core.plan;

import com.firmo.core.tree.TestNode;
import com.firmo.core.tree.TestTree;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Run eligibility for every node of one {@link TestTree}. Produced by {@link FocusResolver};
 * the tree itself is left untouched.
 */
public final class ResolvedPlan {

    private final TestTree tree;
    private final boolean anyFocused;
    private final Map<TestNode, PlanDecision> decisions;

    ResolvedPlan(TestTree tree, boolean anyFocused, IdentityHashMap<TestNode, PlanDecision> decisions) {
        this.tree = tree;
        this.anyFocused = anyFocused;
        this.decisions = decisions;
    }

    public TestTree tree() {
        return tree;
    }

    /** Whether any node in the tree was declared focused. */
    public boolean anyFocused() {
        return anyFocused;
    }

    public PlanDecision decision(TestNode node) {
        PlanDecision d = decisions.get(node);
        if (d == null) {
            throw new IllegalArgumentException("node is not part of this plan: " + node);
        }
        return d;
    }

    public boolean willRun(TestNode node) {
        return decision(node).willRun();
    }

    public String skipReason(TestNode node) {
        return decision(node).skipReason();
    }

    public long runnableCaseCount() {
        return tree.cases().stream().filter(this::willRun).count();
    }
}

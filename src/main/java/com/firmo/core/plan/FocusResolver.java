package com.firmo.core.plan;

import com.firmo.core.tree.FocusState;
import com.firmo.core.tree.TestNode;
import com.firmo.core.tree.TestTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Computes which nodes of a test tree execute.
 * <p>
 * Two passes: the first finds out whether any node is focused anywhere; the second walks
 * top-down carrying whether an ancestor is excluded or focused. Exclusion always wins over
 * focus. When something is focused, only focused nodes and their descendants run. The
 * {@link RunFilter} is applied last, to cases only.
 */
@Service
public class FocusResolver {

    private static final Logger log = LoggerFactory.getLogger(FocusResolver.class);

    static final String REASON_EXCLUDED = "excluded";
    static final String REASON_NOT_FOCUSED = "not focused";
    static final String REASON_TAG = "filtered by tag";
    static final String REASON_PATTERN = "filtered by name pattern";

    public ResolvedPlan resolve(TestTree tree) {
        return resolve(tree, RunFilter.none());
    }

    public ResolvedPlan resolve(TestTree tree, RunFilter filter) {
        boolean anyFocused = tree.nodes().stream().anyMatch(n -> n.focusState() == FocusState.FOCUSED);
        var decisions = new IdentityHashMap<TestNode, PlanDecision>();
        decisions.put(tree.root(), PlanDecision.RUN);
        for (TestNode child : tree.root().children()) {
            visit(child, anyFocused, false, false, filter, decisions);
        }
        ResolvedPlan plan = new ResolvedPlan(tree, anyFocused, decisions);
        log.debug("Resolved plan: {} of {} cases runnable (anyFocused={}, filter={})",
                plan.runnableCaseCount(), tree.cases().size(), anyFocused, filter);
        return plan;
    }

    private void visit(TestNode node, boolean anyFocused, boolean ancestorExcluded, boolean ancestorFocused,
                       RunFilter filter, IdentityHashMap<TestNode, PlanDecision> decisions) {
        boolean excluded = ancestorExcluded || node.focusState() == FocusState.EXCLUDED;
        boolean focused = ancestorFocused || node.focusState() == FocusState.FOCUSED;

        PlanDecision decision;
        if (excluded) {
            decision = PlanDecision.skip(REASON_EXCLUDED);
        } else if (anyFocused && !focused) {
            decision = PlanDecision.skip(REASON_NOT_FOCUSED);
        } else if (node.isCase()) {
            decision = applyFilter(node, filter);
        } else {
            decision = PlanDecision.RUN;
        }
        decisions.put(node, decision);
        log.trace("{} -> {}", node, decision);

        for (TestNode child : node.children()) {
            visit(child, anyFocused, excluded, focused, filter, decisions);
        }
    }

    private PlanDecision applyFilter(TestNode node, RunFilter filter) {
        if (!filter.onlyTags().isEmpty()) {
            Set<String> tags = node.effectiveTags();
            if (filter.onlyTags().stream().noneMatch(tags::contains)) {
                return PlanDecision.skip(REASON_TAG);
            }
        }
        if (filter.namePattern() != null && !filter.namePattern().matcher(node.name()).find()) {
            return PlanDecision.skip(REASON_PATTERN);
        }
        return PlanDecision.RUN;
    }
}

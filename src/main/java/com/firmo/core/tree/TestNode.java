package com.firmo.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A suite or a case in the declared test tree.
 * <p>
 * Nodes are mutable only while {@link TestDsl} is building the tree; once {@link TestDsl#build()}
 * returns, the tree is read-only. A case never has children and a suite never has a body.
 */
public final class TestNode {

    private final int id;
    private final NodeKind kind;
    private final String name;
    private final FocusState focusState;
    private final TestNode parent;
    private final CaseBody body;
    private final CaseOptions options;
    private final List<TestNode> children = new ArrayList<>();
    private final List<Hook> beforeHooks = new ArrayList<>();
    private final List<Hook> afterHooks = new ArrayList<>();
    private final Set<String> tags = new LinkedHashSet<>();

    private TestNode(int id, NodeKind kind, String name, FocusState focusState, TestNode parent,
                     CaseBody body, CaseOptions options) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.focusState = focusState;
        this.parent = parent;
        this.body = body;
        this.options = options;
    }

    static TestNode root() {
        return new TestNode(0, NodeKind.SUITE, "", FocusState.NORMAL, null, null, CaseOptions.defaults());
    }

    static TestNode suite(int id, String name, FocusState focus, TestNode parent) {
        return new TestNode(id, NodeKind.SUITE, name, focus, parent, null, CaseOptions.defaults());
    }

    static TestNode testCase(int id, String name, FocusState focus, TestNode parent,
                             CaseBody body, CaseOptions options) {
        return new TestNode(id, NodeKind.CASE, name, focus, parent, body, options);
    }

    void addChild(TestNode child) {
        if (kind == NodeKind.CASE) {
            throw new IllegalStateException("case '" + name + "' cannot have children");
        }
        children.add(child);
    }

    void addBefore(Hook hook) {
        beforeHooks.add(hook);
    }

    void addAfter(Hook hook) {
        afterHooks.add(hook);
    }

    void addTags(Set<String> more) {
        tags.addAll(more);
    }

    /** Sequence number in declaration order; the synthetic root is 0. */
    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isSuite() {
        return kind == NodeKind.SUITE;
    }

    public boolean isCase() {
        return kind == NodeKind.CASE;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public String name() {
        return name;
    }

    public FocusState focusState() {
        return focusState;
    }

    public TestNode parent() {
        return parent;
    }

    public CaseBody body() {
        return body;
    }

    public CaseOptions options() {
        return options;
    }

    public List<TestNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<Hook> beforeHooks() {
        return Collections.unmodifiableList(beforeHooks);
    }

    public List<Hook> afterHooks() {
        return Collections.unmodifiableList(afterHooks);
    }

    /** Tags declared on this node only. */
    public Set<String> ownTags() {
        return Collections.unmodifiableSet(tags);
    }

    /** Own tags plus case option tags plus everything inherited from enclosing suites. */
    public Set<String> effectiveTags() {
        var all = new LinkedHashSet<String>();
        for (TestNode n = this; n != null; n = n.parent) {
            all.addAll(n.tags);
            all.addAll(n.options.tags());
        }
        return all;
    }

    /** Names of the enclosing suites, outermost first, excluding the synthetic root. */
    public List<String> suitePath() {
        var path = new ArrayList<String>();
        for (TestNode n = parent; n != null && !n.isRoot(); n = n.parent) {
            path.add(0, n.name);
        }
        return path;
    }

    /** Enclosing suites from the root down to the parent, excluding the synthetic root. */
    public List<TestNode> ancestors() {
        var list = new ArrayList<TestNode>();
        for (TestNode n = parent; n != null && !n.isRoot(); n = n.parent) {
            list.add(0, n);
        }
        return list;
    }

    @Override
    public String toString() {
        var path = new ArrayList<>(suitePath());
        path.add(name);
        return kind + "[" + String.join(" / ", path) + "]";
    }
}

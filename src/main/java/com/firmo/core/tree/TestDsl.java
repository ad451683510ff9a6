package com.firmo.core.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builder for a {@link TestTree}. Passed explicitly to every suite body, so there is no
 * ambient registry.
 * <p>
 * Suite bodies run immediately and synchronously; case bodies are only stored. After
 * {@link #build()} the builder rejects further declarations.
 *
 * <pre>{@code
 * TestDsl dsl = new TestDsl();
 * dsl.describe("Calculator", d -> {
 *     d.before(calc::reset);
 *     d.it("adds", ctx -> ctx.expect(calc.add(1, 2)).toEqual(3));
 *     d.xit("divides by zero", ctx -> { });
 * });
 * TestTree tree = dsl.build();
 * }</pre>
 */
public final class TestDsl {

    private static final Logger log = LoggerFactory.getLogger(TestDsl.class);

    /** Name of the placeholder case recorded when a suite body throws. */
    public static final String SUITE_DEFINITION_CASE = "<suite definition>";

    private final TestNode root = TestNode.root();
    private final Deque<TestNode> suites = new ArrayDeque<>();
    private int nextId = 1;
    private boolean built;

    public TestDsl() {
        suites.push(root);
    }

    /** Builds one tree from several specs, in the order given. */
    public static TestTree collect(List<? extends TestSpec> specs) {
        var dsl = new TestDsl();
        for (TestSpec spec : specs) {
            log.debug("Collecting declarations from {}", spec.name());
            dsl.declareTopLevel(spec);
        }
        return dsl.build();
    }

    // -- suites

    public TestDsl describe(String name, SuiteBody body) {
        return suite(name, FocusState.NORMAL, body);
    }

    public TestDsl fdescribe(String name, SuiteBody body) {
        return suite(name, FocusState.FOCUSED, body);
    }

    public TestDsl xdescribe(String name, SuiteBody body) {
        return suite(name, FocusState.EXCLUDED, body);
    }

    // -- cases

    public TestDsl it(String name, CaseBody body) {
        return it(name, CaseOptions.defaults(), body);
    }

    public TestDsl it(String name, CaseOptions options, CaseBody body) {
        return testCase(name, FocusState.NORMAL, options, body);
    }

    public TestDsl fit(String name, CaseBody body) {
        return fit(name, CaseOptions.defaults(), body);
    }

    public TestDsl fit(String name, CaseOptions options, CaseBody body) {
        return testCase(name, FocusState.FOCUSED, options, body);
    }

    public TestDsl xit(String name, CaseBody body) {
        return xit(name, CaseOptions.defaults(), body);
    }

    public TestDsl xit(String name, CaseOptions options, CaseBody body) {
        return testCase(name, FocusState.EXCLUDED, options, body);
    }

    /** A placeholder case with no body. */
    public TestDsl pending(String name) {
        return pending(name, "");
    }

    public TestDsl pending(String name, String reason) {
        return testCase(name, FocusState.NORMAL, CaseOptions.defaults().pending(reason), ctx -> { });
    }

    // -- hooks and tags on the current suite

    public TestDsl before(Hook hook) {
        requireOpen();
        requireArgument(hook, "hook");
        suites.peek().addBefore(hook);
        return this;
    }

    public TestDsl after(Hook hook) {
        requireOpen();
        requireArgument(hook, "hook");
        suites.peek().addAfter(hook);
        return this;
    }

    /** Tags the current suite; every case beneath it inherits them. */
    public TestDsl tags(String... tags) {
        requireOpen();
        suites.peek().addTags(new LinkedHashSet<>(Arrays.asList(tags)));
        return this;
    }

    public TestTree build() {
        requireOpen();
        if (suites.size() != 1) {
            throw new IllegalStateException("build() called from inside a suite body");
        }
        built = true;
        TestTree tree = new TestTree(root);
        log.debug("Built test tree with {} nodes", nextId - 1);
        return tree;
    }

    private void declareTopLevel(TestSpec spec) {
        try {
            spec.define(this);
        } catch (RuntimeException e) {
            log.warn("Spec {} failed while declaring: {}", spec.name(), e.getMessage(), e);
            placeholder(spec.name(), e);
        }
    }

    private TestDsl suite(String name, FocusState focus, SuiteBody body) {
        requireOpen();
        requireArgument(name, "suite name");
        requireArgument(body, "suite body");
        TestNode suite = TestNode.suite(nextId++, name, focus, suites.peek());
        suites.peek().addChild(suite);
        suites.push(suite);
        try {
            body.declare(this);
        } catch (Exception e) {
            log.warn("Suite '{}' failed while declaring its children: {}", name, e.getMessage(), e);
            placeholder(name, e);
        } finally {
            suites.pop();
        }
        return this;
    }

    private void placeholder(String suiteName, Exception cause) {
        String message = "Error while declaring suite '" + suiteName + "': " + cause.getMessage();
        TestNode node = TestNode.testCase(nextId++, SUITE_DEFINITION_CASE, FocusState.NORMAL, suites.peek(),
                ctx -> {
                    throw new SuiteDefinitionException(message, cause);
                },
                CaseOptions.defaults());
        suites.peek().addChild(node);
    }

    private TestDsl testCase(String name, FocusState focus, CaseOptions options, CaseBody body) {
        requireOpen();
        requireArgument(name, "case name");
        requireArgument(options, "case options");
        requireArgument(body, "case body");
        TestNode node = TestNode.testCase(nextId++, name, focus, suites.peek(), body, options);
        suites.peek().addChild(node);
        return this;
    }

    private void requireOpen() {
        if (built) {
            throw new IllegalStateException("test tree already built; declarations are closed");
        }
    }

    private static void requireArgument(Object value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " must not be null");
        }
    }
}

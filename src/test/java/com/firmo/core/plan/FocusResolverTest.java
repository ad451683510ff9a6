package com.firmo.core.plan;

import com.firmo.core.tree.CaseBody;
import com.firmo.core.tree.CaseOptions;
import com.firmo.core.tree.TestDsl;
import com.firmo.core.tree.TestNode;
import com.firmo.core.tree.TestTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FocusResolverTest {

    private static final CaseBody NOOP = ctx -> { };

    private FocusResolver resolver;
    private TestDsl dsl;

    @BeforeEach
    void setUp() {
        resolver = new FocusResolver();
        dsl = new TestDsl();
    }

    private static List<String> runnable(ResolvedPlan plan) {
        return plan.tree().cases().stream().filter(plan::willRun).map(TestNode::name).toList();
    }

    private static TestNode node(ResolvedPlan plan, String... path) {
        return plan.tree().find(path).orElseThrow();
    }

    @Nested
    @DisplayName("without focus")
    class NoFocusTests {

        @Test
        @DisplayName("every case runs")
        void allRun() {
            dsl.describe("A", a -> {
                a.it("one", NOOP);
                a.it("two", NOOP);
            });
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertFalse(plan.anyFocused());
            assertEquals(List.of("one", "two"), runnable(plan));
            assertEquals(2, plan.runnableCaseCount());
        }

        @Test
        @DisplayName("excluded cases and suites are skipped with a reason")
        void exclusion() {
            dsl.describe("A", a -> {
                a.xit("off", NOOP);
                a.it("on", NOOP);
            });
            dsl.xdescribe("B", b -> b.it("inside", NOOP));
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertEquals(List.of("on"), runnable(plan));
            assertEquals(FocusResolver.REASON_EXCLUDED, plan.skipReason(node(plan, "A", "off")));
            assertEquals(FocusResolver.REASON_EXCLUDED, plan.skipReason(node(plan, "B", "inside")));
            assertNull(plan.skipReason(node(plan, "A", "on")));
        }

        @Test
        @DisplayName("an empty tree resolves to nothing")
        void emptyTree() {
            ResolvedPlan plan = resolver.resolve(dsl.build());
            assertEquals(0, plan.runnableCaseCount());
            assertTrue(plan.willRun(plan.tree().root()));
        }
    }

    @Nested
    @DisplayName("with focus")
    class FocusTests {

        @Test
        @DisplayName("a focused case runs alone")
        void focusedCase() {
            dsl.describe("A", a -> a.describe("B", b -> {
                b.fit("Case1", NOOP);
                b.it("Case2", NOOP);
            }));
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertTrue(plan.anyFocused());
            assertEquals(List.of("Case1"), runnable(plan));
            assertEquals(FocusResolver.REASON_NOT_FOCUSED, plan.skipReason(node(plan, "A", "B", "Case2")));
        }

        @Test
        @DisplayName("a focused suite runs all its cases and nothing else")
        void focusedSuite() {
            dsl.fdescribe("G", g -> {
                g.it("a", NOOP);
                g.it("b", NOOP);
            });
            dsl.describe("H", h -> h.it("c", NOOP));
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertEquals(List.of("a", "b"), runnable(plan));
            assertFalse(plan.willRun(node(plan, "H", "c")));
        }

        @Test
        @DisplayName("exclusion wins over focus beneath it")
        void exclusionWins() {
            dsl.xdescribe("X", x -> x.fit("focused inside excluded", NOOP));
            dsl.describe("Y", y -> y.it("plain", NOOP));
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertTrue(plan.anyFocused());
            assertEquals(List.of(), runnable(plan));
            assertEquals(FocusResolver.REASON_EXCLUDED, plan.skipReason(node(plan, "X", "focused inside excluded")));
            assertEquals(FocusResolver.REASON_NOT_FOCUSED, plan.skipReason(node(plan, "Y", "plain")));
        }

        @Test
        @DisplayName("an excluded case inside a focused suite stays excluded")
        void excludedInsideFocused() {
            dsl.fdescribe("F", f -> {
                f.it("runs", NOOP);
                f.xit("does not", NOOP);
            });
            ResolvedPlan plan = resolver.resolve(dsl.build());

            assertEquals(List.of("runs"), runnable(plan));
        }

        @Test
        @DisplayName("resolving leaves the tree untouched")
        void treeUnchanged() {
            dsl.describe("A", a -> a.fit("x", NOOP));
            TestTree tree = dsl.build();

            ResolvedPlan first = resolver.resolve(tree);
            ResolvedPlan second = resolver.resolve(tree);

            assertEquals(runnable(first), runnable(second));
        }
    }

    @Nested
    @DisplayName("run filter")
    class FilterTests {

        @BeforeEach
        void declare() {
            dsl.describe("Db", d -> {
                d.tags("db");
                d.it("reads rows", NOOP);
                d.it("writes rows", CaseOptions.defaults().tags("slow"), NOOP);
            });
            dsl.describe("Api", a -> a.it("returns json", NOOP));
        }

        @Test
        @DisplayName("tag filter keeps cases carrying any listed tag, inherited or own")
        void tags() {
            ResolvedPlan plan = resolver.resolve(dsl.build(), RunFilter.of(Set.of("db"), null));
            assertEquals(List.of("reads rows", "writes rows"), runnable(plan));
            assertEquals(FocusResolver.REASON_TAG, plan.skipReason(node(plan, "Api", "returns json")));

            TestDsl again = new TestDsl();
            again.describe("Db", d -> {
                d.tags("db");
                d.it("reads rows", NOOP);
                d.it("writes rows", CaseOptions.defaults().tags("slow"), NOOP);
            });
            ResolvedPlan slow = resolver.resolve(again.build(), RunFilter.of(Set.of("slow"), null));
            assertEquals(List.of("writes rows"), runnable(slow));
        }

        @Test
        @DisplayName("name pattern matches anywhere in the case name")
        void pattern() {
            ResolvedPlan plan = resolver.resolve(dsl.build(), RunFilter.of(Set.of(), "rows$"));
            assertEquals(List.of("reads rows", "writes rows"), runnable(plan));
            assertEquals(FocusResolver.REASON_PATTERN, plan.skipReason(node(plan, "Api", "returns json")));
        }

        @Test
        @DisplayName("an empty filter changes nothing")
        void emptyFilter() {
            RunFilter filter = RunFilter.of(Set.of(), "");
            assertTrue(filter.isEmpty());
            assertEquals(3, resolver.resolve(dsl.build(), filter).runnableCaseCount());
        }

        @Test
        @DisplayName("a node from another tree is rejected")
        void foreignNode() {
            ResolvedPlan plan = resolver.resolve(dsl.build());
            TestDsl other = new TestDsl();
            other.it("stranger", NOOP);
            TestNode stranger = other.build().cases().get(0);

            assertThrows(IllegalArgumentException.class, () -> plan.decision(stranger));
        }
    }
}

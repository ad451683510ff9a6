package com.firmo.dispatch.cli;

import com.firmo.core.plan.FocusResolver;
import com.firmo.core.plan.PlanDecision;
import com.firmo.core.plan.ResolvedPlan;
import com.firmo.core.plan.RunFilter;
import com.firmo.core.tree.TestDsl;
import com.firmo.core.tree.TestNode;
import com.firmo.core.tree.TestSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.PatternSyntaxException;

/**
 * CLI command: firmo list [spec-class...] [--tag T]... [--pattern REGEX]
 * <p>
 * Prints the declared tree and which cases would run, without running anything.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "Show which cases would run")
@Component
public class ListCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "SPEC",
            description = "Fully qualified TestSpec class names; all registered specs when omitted")
    private List<String> specClasses = new ArrayList<>();

    @Option(names = {"--tag", "-t"}, description = "Only run cases carrying this tag (repeatable)")
    private List<String> tags = new ArrayList<>();

    @Option(names = {"--pattern", "-p"}, description = "Only run cases whose name matches this regex")
    private String pattern;

    private final SpecLoader specLoader;
    private final FocusResolver resolver;

    public ListCommand(SpecLoader specLoader, FocusResolver resolver) {
        this.specLoader = specLoader;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        List<TestSpec> specs;
        RunFilter filter;
        try {
            specs = specLoader.load(specClasses);
            filter = RunFilter.of(new LinkedHashSet<>(tags), pattern);
        } catch (SpecLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (PatternSyntaxException e) {
            ConsoleOutput.error("Invalid --pattern: " + e.getDescription());
            return 1;
        }

        ResolvedPlan plan = resolver.resolve(TestDsl.collect(specs), filter);
        for (TestNode child : plan.tree().root().children()) {
            print(child, plan, 0);
        }
        ConsoleOutput.info(plan.runnableCaseCount() + " of " + plan.tree().cases().size() + " case(s) would run");
        return 0;
    }

    private void print(TestNode node, ResolvedPlan plan, int depth) {
        PlanDecision d = plan.decision(node);
        ConsoleOutput.planEntry(depth, node.name(), node.isCase(), d.willRun(), d.skipReason());
        for (TestNode child : node.children()) {
            print(child, plan, depth + 1);
        }
    }
}

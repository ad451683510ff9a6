package com.firmo.dispatch.cli;

import com.firmo.core.engine.TestExecutor;
import com.firmo.core.events.EventBus;
import com.firmo.core.events.FirmoEvents;
import com.firmo.core.plan.FocusResolver;
import com.firmo.core.plan.ResolvedPlan;
import com.firmo.core.plan.RunFilter;
import com.firmo.core.results.RunSummary;
import com.firmo.core.results.RunSummaryWriter;
import com.firmo.core.tree.TestDsl;
import com.firmo.core.tree.TestSpec;
import com.firmo.core.tree.TestTree;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.regex.PatternSyntaxException;

/**
 * CLI command: firmo run [spec-class...] [--tag T]... [--pattern REGEX] [--json FILE]
 * <p>
 * Builds one tree from the given specs (or every registered spec), resolves focus, exclusion
 * and filters, runs it, prints progress and a summary. Exit code 0 when nothing failed or
 * errored, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run test specs")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "SPEC",
            description = "Fully qualified TestSpec class names; all registered specs when omitted")
    private List<String> specClasses = new ArrayList<>();

    @Option(names = {"--tag", "-t"}, description = "Only run cases carrying this tag (repeatable)")
    private List<String> tags = new ArrayList<>();

    @Option(names = {"--pattern", "-p"}, description = "Only run cases whose name matches this regex")
    private String pattern;

    @Option(names = {"--json"}, description = "Write the run summary as JSON to this file")
    private Path jsonOutput;

    @Option(names = {"--quiet", "-q"}, description = "Only print the summary")
    private boolean quiet;

    private final SpecLoader specLoader;
    private final FocusResolver resolver;
    private final TestExecutor executor;
    private final EventBus eventBus;

    public RunCommand(SpecLoader specLoader, FocusResolver resolver, TestExecutor executor, EventBus eventBus) {
        this.specLoader = specLoader;
        this.resolver = resolver;
        this.executor = executor;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

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
        if (specs.isEmpty()) {
            ConsoleOutput.error("No test specs found");
            return 1;
        }

        TestTree tree = TestDsl.collect(specs);
        ResolvedPlan plan = resolver.resolve(tree, filter);
        ConsoleOutput.info("Running " + plan.runnableCaseCount() + " of " + tree.cases().size() + " case(s)"
                + (plan.anyFocused() ? " (focus mode)" : ""));

        String runId = UUID.randomUUID().toString().substring(0, 8);
        EventBus.Subscription subscription = quiet ? null : eventBus.subscribe(runId, event -> {
            switch (event.eventType()) {
                case FirmoEvents.SUITE_STARTED -> ConsoleOutput.suite(event.caseName());
                case FirmoEvents.CASE_FINISHED -> ConsoleOutput.caseResult(
                        String.valueOf(event.payload().get("status")), event.caseName(),
                        ((Number) event.payload().get("durationMs")).longValue());
                default -> { }
            }
        });

        RunSummary summary;
        try {
            summary = executor.run(plan, runId);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.summary(summary);
        if (jsonOutput != null) {
            new RunSummaryWriter().write(summary, jsonOutput);
            ConsoleOutput.info("Summary written to " + jsonOutput);
        }
        return summary.successful() ? 0 : 1;
    }
}

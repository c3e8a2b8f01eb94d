package work.lcod.chartlint.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.coverage.CoverageReconciler;
import work.lcod.chartlint.coverage.CoverageReport;
import work.lcod.chartlint.instrument.MarkerInjector;
import work.lcod.chartlint.instrument.MarkerScanner;
import work.lcod.chartlint.render.Fixture;
import work.lcod.chartlint.render.FixtureLoader;
import work.lcod.chartlint.render.RenderOrchestrator;
import work.lcod.chartlint.runtime.FailureCollector;
import work.lcod.chartlint.runtime.LintException;
import work.lcod.chartlint.runtime.RunContext;
import work.lcod.chartlint.runtime.TaskGroup;
import work.lcod.chartlint.runtime.Workspace;

/**
 * Public entry point: lints one chart against its fixtures and policies.
 * <p>
 * Setup, instrumentation and rendering abort the run on the first failure. Scanning, coverage,
 * policies, recursion and observers keep going and report every failure they find.
 */
public final class LintRunner {
    private static final Logger log = LoggerFactory.getLogger(LintRunner.class);

    public LintResult run(LintOptions options) {
        var started = Instant.now();
        var failures = new FailureCollector();
        CoverageReport coverage = CoverageReport.empty(options.coverageMode());
        List<String> fixtureNames = List.of();
        Optional<Path> preserved = Optional.empty();

        try {
            List<Fixture> fixtures = FixtureLoader.load(options.fixturesDirs());
            fixtureNames = fixtures.stream().map(Fixture::name).collect(Collectors.toList());
            if (fixtures.isEmpty()) {
                log.warn("no fixtures found in {}", options.fixturesDirs());
            }
            try (var workspace = Workspace.create(options.preserve());
                 var ctx = new RunContext(options, workspace, failures)) {
                preserved = workspace.preservedRoot();
                coverage = lint(ctx, fixtures);
            }
        } catch (LintException ex) {
            failures.add(ex.category(), "run", ex.getMessage());
        }

        var result = LintResult.of(coverage, failures.snapshot(), fixtureNames, preserved, started);
        if (result.succeeded()) {
            log.info("chart {} passed: {}/{} branches covered", options.chartDir(), coverage.covered(), coverage.expected());
        } else {
            log.error("chart {} failed with {} problem(s)", options.chartDir(), result.failures().size());
        }
        return result;
    }

    private CoverageReport lint(RunContext ctx, List<Fixture> fixtures) {
        var options = ctx.options();
        var workspace = ctx.workspace();

        Path chart = workspace.copyChart(options.chartDir());
        var registry = MarkerInjector.inject(chart, ctx.newGroup());
        log.debug("instrumented {} branch declaration(s)", registry.size());

        List<Path> outputs = RenderOrchestrator.renderAll(
            options.renderer(), chart, fixtures, workspace.resultsDir(), ctx.newGroup(), ctx.failures()
        );

        var surviving = MarkerScanner.scan(workspace.resultsDir(), ctx.newGroup(), ctx.failures());
        var coverage = CoverageReconciler.reconcile(
            registry, surviving, options.coverageMode(), options.chartDir(), ctx.newGroup(), ctx.failures()
        );

        runPostRenderActions(ctx, outputs);
        return coverage;
    }

    private void runPostRenderActions(RunContext ctx, List<Path> outputs) {
        TaskGroup group = ctx.newGroup();
        List<PostRenderAction> actions = ctx.options().postRenderActions();
        for (Path output : outputs) {
            for (PostRenderAction action : actions) {
                group.submit(() -> {
                    try {
                        action.apply(ctx, output);
                    } catch (RuntimeException ex) {
                        ctx.failures().add(LintFailure.Category.SETUP, action.describe() + " on " + output.getFileName(), TaskGroup.messageOf(ex));
                    }
                });
            }
        }
        for (Throwable error : group.await()) {
            ctx.failures().add(LintFailure.Category.SETUP, "post-render", "interrupted: " + TaskGroup.messageOf(error));
        }
    }
}

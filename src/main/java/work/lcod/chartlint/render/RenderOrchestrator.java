package work.lcod.chartlint.render;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.runtime.FailureCollector;
import work.lcod.chartlint.runtime.LintException;
import work.lcod.chartlint.runtime.TaskGroup;

/**
 * Renders the instrumented chart once per fixture.
 */
public final class RenderOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RenderOrchestrator.class);

    private RenderOrchestrator() {}

    /**
     * Renders every fixture into {@code resultsDir/<fixture>}. Renders run in parallel and all of them
     * finish before failures are evaluated; a single failed fixture aborts the run afterwards.
     *
     * @return the output directories, in fixture order
     * @throws LintException when at least one fixture failed to render
     */
    public static List<Path> renderAll(
        TemplateRenderer renderer,
        Path chartDir,
        List<Fixture> fixtures,
        Path resultsDir,
        TaskGroup group,
        FailureCollector failures
    ) {
        var started = Instant.now();
        List<Path> outputDirs = new ArrayList<>();
        for (Fixture fixture : fixtures) {
            Path outputDir = resultsDir.resolve(fixture.name());
            outputDirs.add(outputDir);
            group.submit(() -> {
                var result = renderer.render(chartDir, fixture.valuesFile(), outputDir);
                if (!result.succeeded()) {
                    failures.add(
                        LintFailure.Category.RENDER,
                        fixture.name(),
                        "rendering chart with fixture \"" + fixture.valuesFile().getFileName() + "\": " + result.output()
                    );
                }
            });
        }

        int crashed = 0;
        for (Throwable error : group.await()) {
            crashed++;
            failures.add(LintFailure.Category.RENDER, "renderer", "rendering chart: " + TaskGroup.messageOf(error));
        }
        int failed = failures.count(LintFailure.Category.RENDER);
        log.info("rendered the chart for every fixture in {}", Duration.between(started, Instant.now()));
        if (failed > 0) {
            throw new LintException(
                LintFailure.Category.RENDER,
                failed + " of " + fixtures.size() + " fixture render(s) failed" + (crashed > 0 ? " (" + crashed + " crashed)" : "")
            );
        }
        return outputDirs;
    }
}

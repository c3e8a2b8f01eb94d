package work.lcod.chartlint.recursion;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.coverage.CoverageMode;
import work.lcod.chartlint.coverage.CoverageReconciler;
import work.lcod.chartlint.instrument.MarkerInjector;
import work.lcod.chartlint.instrument.MarkerScanner;
import work.lcod.chartlint.instrument.YamlFiles;
import work.lcod.chartlint.policy.PolicyEngine;
import work.lcod.chartlint.policy.PolicyRunner;
import work.lcod.chartlint.runtime.FailureCollector;
import work.lcod.chartlint.runtime.LintException;
import work.lcod.chartlint.runtime.TaskGroup;
import work.lcod.chartlint.runtime.Workspace;

/**
 * Applies one recursion rule to one rendered output directory.
 * <p>
 * Embedded manifests are already rendered, so the nested pass skips rendering: the extracted files
 * are instrumented, scanned and reconciled in place, then checked against the rule's policies.
 * Nested work runs on the calling thread.
 */
public final class RecursionController {
    private static final Logger log = LoggerFactory.getLogger(RecursionController.class);

    private RecursionController() {}

    public static Outcome descend(
        RecursionRule rule,
        Path renderedDir,
        Workspace workspace,
        PolicyEngine engine,
        FailureCollector failures
    ) throws InterruptedException {
        String label = renderedDir.getFileName() + " -> " + rule.name();
        Path target;
        try {
            target = workspace.newRecursionTarget(String.valueOf(renderedDir.getFileName()));
            rule.extraction().extract(renderedDir, target);
            if (!YamlFiles.containsFiles(target)) {
                log.debug("recursion {} extracted nothing", label);
                return Outcome.SKIPPED;
            }
        } catch (IOException | RuntimeException ex) {
            failures.add(LintFailure.Category.RECURSION, label, "extracting nested manifests: " + TaskGroup.messageOf(ex));
            return Outcome.FAILED;
        }

        var nested = new FailureCollector();
        try {
            var registry = MarkerInjector.inject(target, TaskGroup.inline());
            var tokens = MarkerScanner.scan(target, TaskGroup.inline(), nested);
            CoverageReconciler.reconcile(registry, tokens, CoverageMode.VERIFY, target, TaskGroup.inline(), nested);
            PolicyRunner.check(engine, rule.policiesDir(), target, label, nested);
        } catch (LintException ex) {
            nested.add(LintFailure.Category.RECURSION, label, ex.getMessage());
        }
        nested.snapshot().forEach(failures::add);
        return nested.isEmpty() ? Outcome.PASSED : Outcome.FAILED;
    }

    public enum Outcome {
        /** The extraction wrote no files; no nested pass ran. */
        SKIPPED,
        PASSED,
        FAILED
    }
}

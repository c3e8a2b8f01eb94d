package work.lcod.chartlint.policy;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.runtime.ExternalCommand;
import work.lcod.chartlint.runtime.FailureCollector;

/**
 * Runs the policy engine against one rendered directory. The tool output is always logged;
 * a failing evaluation is also recorded as a policy failure.
 */
public final class PolicyRunner {
    private static final Logger log = LoggerFactory.getLogger(PolicyRunner.class);

    private PolicyRunner() {}

    public static boolean check(PolicyEngine engine, Path policiesDir, Path targetDir, String label, FailureCollector failures)
        throws InterruptedException {
        ExternalCommand.Result result;
        try {
            result = engine.evaluate(policiesDir, targetDir);
        } catch (IOException ex) {
            result = ExternalCommand.Result.failure(-1, ex.getMessage());
        }

        String output = result.output().isBlank() && !result.succeeded()
            ? "policy engine exited with code " + result.exitCode()
            : result.output();
        if (result.succeeded()) {
            log.info("Conftest output ({}):\n{}", label, output);
            return true;
        }
        log.error("Conftest failure ({}):\n{}", label, output);
        failures.add(LintFailure.Category.POLICY, label, "Conftest failure (" + label + "):\n" + output);
        return false;
    }
}

package work.lcod.chartlint.policy;

import java.io.IOException;
import java.nio.file.Path;
import work.lcod.chartlint.runtime.ExternalCommand;

/**
 * Evaluates a policy set against a directory of rendered manifests. Exit code 0 means every policy passed.
 */
@FunctionalInterface
public interface PolicyEngine {
    ExternalCommand.Result evaluate(Path policiesDir, Path targetDir) throws IOException, InterruptedException;
}

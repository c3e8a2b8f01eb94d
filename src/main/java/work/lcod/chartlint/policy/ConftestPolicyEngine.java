package work.lcod.chartlint.policy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import work.lcod.chartlint.runtime.ExternalCommand;

/**
 * {@code conftest test --policy <policies> <dir>}.
 */
public final class ConftestPolicyEngine implements PolicyEngine {
    public static final String DEFAULT_EXECUTABLE = "conftest";

    private final String executable;

    public ConftestPolicyEngine() {
        this(DEFAULT_EXECUTABLE);
    }

    public ConftestPolicyEngine(String executable) {
        this.executable = executable == null || executable.isBlank() ? DEFAULT_EXECUTABLE : executable;
    }

    @Override
    public ExternalCommand.Result evaluate(Path policiesDir, Path targetDir) throws IOException, InterruptedException {
        return ExternalCommand.run(command(policiesDir, targetDir), null);
    }

    List<String> command(Path policiesDir, Path targetDir) {
        return List.of(executable, "test", "--policy", policiesDir.toString(), targetDir.toString());
    }
}

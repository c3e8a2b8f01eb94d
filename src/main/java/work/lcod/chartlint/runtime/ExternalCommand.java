package work.lcod.chartlint.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external tool and captures its combined stdout/stderr.
 */
public final class ExternalCommand {
    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);

    private ExternalCommand() {}

    public static Result run(List<String> command, Path workingDirectory) throws IOException, InterruptedException {
        log.debug("exec: {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        pb.redirectErrorStream(true);
        Process process = pb.start();
        String output;
        try (var in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode = process.waitFor();
        log.debug("exit {}: {}", exitCode, command.get(0));
        return new Result(exitCode, output);
    }

    public record Result(int exitCode, String output) {
        public Result {
            output = output == null ? "" : output;
        }

        public static Result success(String output) {
            return new Result(0, output);
        }

        public static Result failure(int exitCode, String output) {
            return new Result(exitCode, output);
        }

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}

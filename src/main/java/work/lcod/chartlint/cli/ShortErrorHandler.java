package work.lcod.chartlint.cli;

import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import picocli.CommandLine;
import work.lcod.chartlint.api.LintResult;
import work.lcod.chartlint.runtime.LintException;

/**
 * Prints one line per CLI failure. Lint errors carry their category and exit like a failed run;
 * anything else uses picocli's execution exit code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "chartlint.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = unwrap(ex);
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(root)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (root instanceof LintException) {
            return LintResult.Status.FAILURE.exitCode();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof UncheckedIOException
            || current instanceof ExecutionException
            || current instanceof CompletionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        if (error instanceof LintException lint) {
            return lint.category().name().toLowerCase() + " error: " + message;
        }
        return message;
    }
}

package work.lcod.chartlint.render;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import work.lcod.chartlint.runtime.ExternalCommand;

/**
 * {@code helm template --output-dir <out> --values <fixture> <chart>}.
 */
public final class HelmRenderer implements TemplateRenderer {
    public static final String DEFAULT_EXECUTABLE = "helm";

    private final String executable;

    public HelmRenderer() {
        this(DEFAULT_EXECUTABLE);
    }

    public HelmRenderer(String executable) {
        this.executable = executable == null || executable.isBlank() ? DEFAULT_EXECUTABLE : executable;
    }

    @Override
    public ExternalCommand.Result render(Path chartDir, Path valuesFile, Path outputDir) throws IOException, InterruptedException {
        return ExternalCommand.run(command(chartDir, valuesFile, outputDir), null);
    }

    List<String> command(Path chartDir, Path valuesFile, Path outputDir) {
        return List.of(
            executable,
            "template",
            "--output-dir", outputDir.toString(),
            "--values", valuesFile.toString(),
            chartDir.toString()
        );
    }
}

package work.lcod.chartlint.render;

import java.io.IOException;
import java.nio.file.Path;
import work.lcod.chartlint.runtime.ExternalCommand;

/**
 * Renders a chart with one values file into a directory, one file per template with relative paths
 * preserved. A non-zero exit code marks the render as failed.
 */
@FunctionalInterface
public interface TemplateRenderer {
    ExternalCommand.Result render(Path chartDir, Path valuesFile, Path outputDir) throws IOException, InterruptedException;
}

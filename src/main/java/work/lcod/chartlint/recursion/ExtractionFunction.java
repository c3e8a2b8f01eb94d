package work.lcod.chartlint.recursion;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Pulls manifests embedded in a rendered chart (e.g. the data of a ConfigMap) out into
 * {@code targetDir}, one YAML file per manifest. Writing nothing is valid.
 */
@FunctionalInterface
public interface ExtractionFunction {
    void extract(Path renderedDir, Path targetDir) throws IOException;
}

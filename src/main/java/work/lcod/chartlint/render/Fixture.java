package work.lcod.chartlint.render;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A values file driving one render; {@code name} is the file name without its extension and names
 * the output directory.
 */
public record Fixture(String name, Path valuesFile) {
    public Fixture {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(valuesFile, "valuesFile");
    }
}

package work.lcod.chartlint.recursion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An extraction function with its own, already resolved, policies directory.
 */
public record RecursionRule(String name, ExtractionFunction extraction, Path policiesDir) {
    public RecursionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(policiesDir, "policiesDir");
        if (!policiesDir.isAbsolute()) {
            throw new IllegalArgumentException("policiesDir must be absolute: " + policiesDir);
        }
    }
}

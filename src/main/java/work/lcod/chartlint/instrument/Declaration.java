package work.lcod.chartlint.instrument;

import java.util.Objects;

/**
 * A conditional branch found in a template. {@code file} is relative to the scanned root and uses
 * {@code /} separators; {@code line} is zero-based.
 */
public record Declaration(String file, int line, String source) {
    public Declaration {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(source, "source");
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0");
        }
    }

    /** Human-facing {@code file:line}, one-based. */
    public String location() {
        return file + ":" + (line + 1);
    }
}

package work.lcod.chartlint.coverage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.instrument.Declaration;
import work.lcod.chartlint.instrument.DeclarationRegistry;
import work.lcod.chartlint.instrument.LineClassifier;
import work.lcod.chartlint.instrument.Markers;
import work.lcod.chartlint.runtime.FailureCollector;
import work.lcod.chartlint.runtime.TaskGroup;

/**
 * Compares the declarations of a run with the markers that survived rendering.
 */
public final class CoverageReconciler {
    private static final Logger log = LoggerFactory.getLogger(CoverageReconciler.class);
    static final String NOT_FOUND = "Branch was not found in the rendered chart output";

    private CoverageReconciler() {}

    /**
     * @param sourceRoot the caller's original chart; only written to in {@link CoverageMode#WRITE_EXCEPTIONS}
     */
    public static CoverageReport reconcile(
        DeclarationRegistry registry,
        Set<String> surviving,
        CoverageMode mode,
        Path sourceRoot,
        TaskGroup group,
        FailureCollector failures
    ) {
        List<Declaration> uncovered = new ArrayList<>();
        for (var entry : registry.entries().entrySet()) {
            if (!surviving.contains(entry.getKey())) {
                uncovered.add(entry.getValue());
            }
        }
        uncovered.sort(Comparator.comparing(Declaration::file).thenComparingInt(Declaration::line));
        int covered = registry.size() - uncovered.size();

        if (mode == CoverageMode.VERIFY) {
            for (Declaration declaration : uncovered) {
                failures.add(LintFailure.Category.COVERAGE, declaration.location(), NOT_FOUND + ":\n  " + declaration.source());
            }
            return new CoverageReport(mode, registry.size(), covered, uncovered, List.of());
        }

        Map<String, List<Declaration>> byFile = new TreeMap<>();
        for (Declaration declaration : uncovered) {
            byFile.computeIfAbsent(declaration.file(), f -> new ArrayList<>()).add(declaration);
        }
        List<String> rewritten = new ArrayList<>();
        for (var entry : byFile.entrySet()) {
            Path file = sourceRoot.resolve(entry.getKey());
            group.submit(() -> {
                writeExceptions(file, entry.getValue());
                synchronized (rewritten) {
                    rewritten.add(entry.getKey());
                }
            });
        }
        for (Throwable error : group.await()) {
            failures.add(LintFailure.Category.COVERAGE, sourceRoot.toString(), "writing exceptions: " + TaskGroup.messageOf(error));
        }
        synchronized (rewritten) {
            rewritten.sort(Comparator.naturalOrder());
            return new CoverageReport(mode, registry.size(), covered, uncovered, rewritten);
        }
    }

    /**
     * Puts a suppression comment above each declaration, at the indentation a marker would get.
     */
    static void writeExceptions(Path file, List<Declaration> declarations) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        List<String> lines = Arrays.asList(content.split("\n", -1));
        List<String> rewritten = new ArrayList<>(lines);
        for (Declaration declaration : declarations) {
            int index = declaration.line();
            if (index >= lines.size() || !lines.get(index).trim().equals(declaration.source())) {
                throw new IOException(file + " changed since it was instrumented; expected `" + declaration.source() + "` at line " + (index + 1));
            }
            String indentation = LineClassifier.indent(LineClassifier.indentation(lines, index));
            rewritten.set(index, indentation + Markers.SUPPRESSION_COMMENT + "\n" + lines.get(index));
            log.warn("ignoring uncovered branch {}: {}", declaration.location(), declaration.source());
        }
        Files.writeString(file, String.join("\n", rewritten), StandardCharsets.UTF_8);
    }
}

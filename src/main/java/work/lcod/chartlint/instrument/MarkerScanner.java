package work.lcod.chartlint.instrument;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.runtime.FailureCollector;
import work.lcod.chartlint.runtime.TaskGroup;

/**
 * Collects the marker tokens that survived rendering.
 */
public final class MarkerScanner {
    private MarkerScanner() {}

    public static Set<String> scan(Path root, TaskGroup group, FailureCollector failures) {
        List<Path> files;
        try {
            files = YamlFiles.collect(root);
        } catch (IOException ex) {
            failures.add(LintFailure.Category.SCAN, root.toString(), "discovering comments: " + ex.getMessage());
            return Set.of();
        }

        Set<String> tokens = new HashSet<>();
        for (Path file : files) {
            group.submit(() -> {
                List<String> found = scanFile(file);
                synchronized (tokens) {
                    tokens.addAll(found);
                }
            });
        }
        for (Throwable error : group.await()) {
            failures.add(LintFailure.Category.SCAN, root.toString(), "discovering comments: " + TaskGroup.messageOf(error));
        }
        synchronized (tokens) {
            return Set.copyOf(tokens);
        }
    }

    public static List<String> scanFile(Path file) throws IOException {
        List<String> found = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                int at = line.indexOf(Markers.MARKER_PREFIX);
                if (at >= 0) {
                    found.add(line.substring(at + Markers.MARKER_PREFIX.length()).trim());
                }
            }
        }
        return found;
    }
}

package work.lcod.chartlint.instrument;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Snapshot of the YAML files below a directory, taken before any per-file work is fanned out.
 * Walk errors surface as {@link IOException}.
 */
public final class YamlFiles {
    public static final String EXTENSION = ".yaml";

    private YamlFiles() {}

    public static List<Path> collect(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
    }

    public static boolean containsFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.anyMatch(Files::isRegularFile);
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
    }

    static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace(File.separatorChar, '/');
    }
}

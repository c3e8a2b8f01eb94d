package work.lcod.chartlint.runtime;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;

/**
 * Temporary directory owned by one run: the instrumented chart copy, rendered results and
 * recursion targets. Deleted on close unless the run asked to preserve it.
 */
public final class Workspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;
    private final boolean preserve;
    private final AtomicInteger targets = new AtomicInteger();

    private Workspace(Path root, boolean preserve) {
        this.root = root;
        this.preserve = preserve;
    }

    public static Workspace create(boolean preserve) {
        try {
            return new Workspace(Files.createTempDirectory("chartlint-"), preserve);
        } catch (IOException ex) {
            throw new LintException(LintFailure.Category.SETUP, "creating tempdir: " + ex.getMessage(), ex);
        }
    }

    public Path root() {
        return root;
    }

    public Path chartDir() {
        return root.resolve("chart");
    }

    public Path resultsDir() {
        return root.resolve("results");
    }

    public Optional<Path> preservedRoot() {
        return preserve ? Optional.of(root) : Optional.empty();
    }

    /**
     * Copies the caller's chart into {@link #chartDir()} so instrumentation never touches the original.
     */
    public Path copyChart(Path source) {
        if (!Files.isDirectory(source)) {
            throw new LintException(LintFailure.Category.SETUP, "chart directory not found: " + source);
        }
        Path target = chartDir();
        try {
            copyTree(source, target);
        } catch (IOException ex) {
            throw new LintException(LintFailure.Category.SETUP, "copying chart: " + ex.getMessage(), ex);
        }
        return target;
    }

    /**
     * Allocates a fresh, empty directory for one recursion rule applied to one rendered output.
     */
    public Path newRecursionTarget(String label) throws IOException {
        Path dir = root.resolve("recursion").resolve(targets.incrementAndGet() + "-" + label);
        return Files.createDirectories(dir);
    }

    @Override
    public void close() {
        if (preserve) {
            log.info("preserving temporary directory: {}", root);
            return;
        }
        try {
            deleteRecursively(root);
        } catch (IOException ex) {
            log.warn("unable to clean up tempdir {}: {}", root, ex.getMessage());
        }
    }

    static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()), StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}

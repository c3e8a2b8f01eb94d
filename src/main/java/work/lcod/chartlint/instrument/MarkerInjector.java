package work.lcod.chartlint.instrument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.runtime.LintException;
import work.lcod.chartlint.runtime.TaskGroup;

/**
 * Writes a uniquely tokened trace comment after every conditional branch of a template tree.
 * <p>
 * There is no parser that understands both Go templates and YAML, so coverage is measured by
 * checking which of these comments survive rendering. The tree is rewritten in place: callers pass
 * a private copy.
 */
public final class MarkerInjector {
    private static final Logger log = LoggerFactory.getLogger(MarkerInjector.class);

    private MarkerInjector() {}

    /**
     * Instruments every YAML file below {@code root} and returns the frozen registry of declarations.
     *
     * @throws LintException when any file cannot be read or written
     */
    public static DeclarationRegistry inject(Path root, TaskGroup group) {
        List<Path> files;
        try {
            files = YamlFiles.collect(root);
        } catch (IOException ex) {
            throw new LintException(LintFailure.Category.INSTRUMENTATION, "injecting comments: " + ex.getMessage(), ex);
        }

        var registry = new DeclarationRegistry();
        for (Path file : files) {
            group.submit(() -> instrumentFile(root, file, registry));
        }
        group.awaitOrAbort(LintFailure.Category.INSTRUMENTATION, "injecting comments");
        log.debug("instrumented {} branch(es) in {} file(s) under {}", registry.size(), files.size(), root);
        return registry.freeze();
    }

    static int instrumentFile(Path root, Path file, DeclarationRegistry registry) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        List<String> lines = Arrays.asList(content.split("\n", -1));
        List<String> rewritten = new ArrayList<>(lines);
        String name = YamlFiles.relativeName(root, file);

        int injected = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (!LineClassifier.isDeclaration(lines, i)) {
                continue;
            }
            String line = lines.get(i);
            String token = UUID.randomUUID().toString();
            String indentation = LineClassifier.indent(LineClassifier.indentation(lines, i));
            registry.register(token, new Declaration(name, i, line.trim()));
            rewritten.set(i, line + "\n" + indentation + Markers.marker(token));
            injected++;
        }

        if (injected > 0) {
            Files.writeString(file, String.join("\n", rewritten), StandardCharsets.UTF_8);
        }
        return injected;
    }
}

package work.lcod.chartlint.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.instrument.YamlFiles;
import work.lcod.chartlint.runtime.LintException;

/**
 * Lists the fixtures (top-level {@code *.yaml} files) of one or more fixtures directories.
 */
public final class FixtureLoader {
    private FixtureLoader() {}

    public static List<Fixture> load(List<Path> directories) {
        Map<String, Fixture> byName = new LinkedHashMap<>();
        for (Path dir : directories) {
            for (Path file : listValuesFiles(dir)) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - YamlFiles.EXTENSION.length());
                Fixture previous = byName.putIfAbsent(name, new Fixture(name, file));
                if (previous != null) {
                    throw new LintException(
                        LintFailure.Category.SETUP,
                        "duplicate fixture name \"" + name + "\": " + previous.valuesFile() + " and " + file
                    );
                }
            }
        }
        return new ArrayList<>(byName.values());
    }

    private static List<Path> listValuesFiles(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(YamlFiles.EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new LintException(LintFailure.Category.SETUP, "reading fixtures directory " + dir + ": " + ex.getMessage(), ex);
        }
    }
}

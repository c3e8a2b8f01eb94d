package work.lcod.chartlint.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.chartlint.runtime.LintException;

/**
 * Optional {@code chartlint.toml} kept next to a chart:
 *
 * <pre>
 * fixtures = ["fixtures", "ci-fixtures"]
 * policies = "policies"
 * concurrency = 8
 * write_exceptions = false
 * preserve = false
 *
 * [[recursion]]
 * configmap = "mychart/templates/configmap.yaml"
 * policies = "nested-policies"
 * </pre>
 *
 * Paths are relative to the chart directory.
 */
public record LintConfigFile(
    Path source,
    List<String> fixtures,
    Optional<String> policies,
    Optional<Integer> concurrency,
    Optional<Boolean> writeExceptions,
    Optional<Boolean> preserve,
    List<Recursion> recursions
) {
    public static final String DEFAULT_NAME = "chartlint.toml";

    public LintConfigFile {
        fixtures = List.copyOf(fixtures);
        recursions = List.copyOf(recursions);
    }

    public static Optional<LintConfigFile> discover(Path chartDir) {
        Path candidate = chartDir.resolve(DEFAULT_NAME);
        if (!Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(load(candidate));
    }

    public static LintConfigFile load(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LintException(LintFailure.Category.SETUP, "Cannot read config file " + file + ": " + ex.getMessage(), ex);
        }
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            throw new LintException(LintFailure.Category.SETUP, "Invalid config file " + file + ": " + result.errors().get(0));
        }
        try {
            Long concurrency = result.getLong("concurrency");
            return new LintConfigFile(
                file,
                strings(result.getArray("fixtures")),
                Optional.ofNullable(result.getString("policies")),
                Optional.ofNullable(concurrency).map(Long::intValue),
                Optional.ofNullable(result.getBoolean("write_exceptions")),
                Optional.ofNullable(result.getBoolean("preserve")),
                recursions(result.getArray("recursion"))
            );
        } catch (RuntimeException ex) {
            throw new LintException(LintFailure.Category.SETUP, "Invalid config file " + file + ": " + ex.getMessage(), ex);
        }
    }

    public LintOptions.Builder applyTo(LintOptions.Builder builder) {
        if (!fixtures.isEmpty()) {
            builder.fixturesDirs(fixtures);
        }
        policies.ifPresent(builder::policiesDir);
        concurrency.ifPresent(builder::concurrency);
        writeExceptions.ifPresent(builder::writeExceptions);
        preserve.ifPresent(builder::preserve);
        for (Recursion recursion : recursions) {
            builder.recurseConfigMap(recursion.configmap(), recursion.policies().orElse(null));
        }
        return builder;
    }

    private static List<String> strings(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static List<Recursion> recursions(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        List<Recursion> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            TomlTable table = array.getTable(i);
            String configmap = table.getString("configmap");
            if (configmap == null || configmap.isBlank()) {
                throw new IllegalArgumentException("recursion[" + i + "] requires a configmap path");
            }
            values.add(new Recursion(configmap, Optional.ofNullable(table.getString("policies"))));
        }
        return values;
    }

    public record Recursion(String configmap, Optional<String> policies) {}
}

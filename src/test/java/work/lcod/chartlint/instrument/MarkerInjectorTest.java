package work.lcod.chartlint.instrument;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.runtime.LintException;
import work.lcod.chartlint.runtime.TaskGroup;
import work.lcod.chartlint.support.ChartFixtures;
import work.lcod.chartlint.support.FakeTemplateRenderer;

class MarkerInjectorTest {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @TempDir
    Path tmp;

    private ExecutorService pool;

    @BeforeEach
    void startPool() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void stopPool() {
        pool.shutdownNow();
    }

    @Test
    void registersEveryBranchOfTheChart() {
        ChartFixtures.simpleChart(tmp);
        var registry = MarkerInjector.inject(tmp, TaskGroup.on(pool));

        assertTrue(registry.isFrozen());
        assertEquals(3, registry.size());
        var locations = registry.entries().values().stream().map(Declaration::location).sorted().collect(Collectors.toList());
        assertEquals(List.of("templates/configmap.yaml:11", "templates/configmap.yaml:6", "templates/deployment.yaml:11"), locations);
    }

    @Test
    void insertsMarkerAfterDeclarationAtComputedIndentation() throws Exception {
        Path file = ChartFixtures.write(tmp.resolve("templates/configmap.yaml"), ChartFixtures.CONFIGMAP);
        var registry = new DeclarationRegistry();

        assertEquals(2, MarkerInjector.instrumentFile(tmp, file, registry));

        List<String> lines = List.of(ChartFixtures.read(file).split("\n", -1));
        assertEquals("  {{- if .Values.extra }}", lines.get(5));
        assertTrue(lines.get(6).startsWith("  # chartlint: "));
        assertEquals("    {{- if .Values.verbose }}", lines.get(11));
        assertTrue(lines.get(12).startsWith("    # chartlint: "));

        Map<String, Declaration> entries = registry.entries();
        for (var entry : entries.entrySet()) {
            assertTrue(ChartFixtures.read(file).contains(Markers.marker(entry.getKey())));
        }
    }

    @Test
    void keepsLineCountWithoutDeclarations() throws Exception {
        String content = "a: 1\nb: 2\n";
        Path file = ChartFixtures.write(tmp.resolve("plain.yaml"), content);

        assertEquals(0, MarkerInjector.instrumentFile(tmp, file, new DeclarationRegistry()));
        assertEquals(content, ChartFixtures.read(file));
    }

    @Test
    void skipsSuppressedBranches() throws Exception {
        Path file = ChartFixtures.write(tmp.resolve("t.yaml"), "# chartlint:ignore\n{{- if .Values.a }}\nx: 1\n{{- end }}\n");
        var registry = new DeclarationRegistry();

        assertEquals(0, MarkerInjector.instrumentFile(tmp, file, registry));
        assertEquals(0, registry.size());
    }

    @Test
    void ignoresFilesWithOtherExtensions() {
        ChartFixtures.write(tmp.resolve("templates/_helpers.tpl"), "{{- if .Values.a }}\n{{- end }}\n");
        ChartFixtures.write(tmp.resolve("templates/notes.yml"), "{{- if .Values.a }}\n{{- end }}\n");

        assertEquals(0, MarkerInjector.inject(tmp, TaskGroup.inline()).size());
        assertFalse(ChartFixtures.read(tmp.resolve("templates/notes.yml")).contains(Markers.MARKER_PREFIX));
    }

    @Test
    void frozenRegistryAbortsInstrumentation() {
        ChartFixtures.simpleChart(tmp);
        var frozen = new DeclarationRegistry().freeze();
        Path file = tmp.resolve("templates/deployment.yaml");

        assertThrows(IllegalStateException.class, () -> MarkerInjector.instrumentFile(tmp, file, frozen));
    }

    @Test
    void unreadableTreeIsAnInstrumentationFailure() {
        Path missing = tmp.resolve("templates/gone.yaml");
        var group = TaskGroup.inline();
        group.submit(() -> MarkerInjector.instrumentFile(tmp, missing, new DeclarationRegistry()));
        var ex = assertThrows(LintException.class, () -> group.awaitOrAbort(LintFailure.Category.INSTRUMENTATION, "injecting comments"));
        assertEquals(LintFailure.Category.INSTRUMENTATION, ex.category());
        assertTrue(ex.getMessage().startsWith("injecting comments: "));
    }

    @Test
    void markersDoNotChangeRenderedDocuments() throws Exception {
        Path original = ChartFixtures.simpleChart(tmp.resolve("original"));
        Path instrumented = ChartFixtures.simpleChart(tmp.resolve("instrumented"));
        Path values = ChartFixtures.write(tmp.resolve("full.yaml"), "debug: true\nextra: true\nverbose: true\n");
        assertEquals(3, MarkerInjector.inject(instrumented, TaskGroup.on(pool)).size());

        var renderer = new FakeTemplateRenderer();
        assertTrue(renderer.render(original, values, tmp.resolve("out/original")).succeeded());
        assertTrue(renderer.render(instrumented, values, tmp.resolve("out/instrumented")).succeeded());

        for (String template : List.of("deployment.yaml", "configmap.yaml")) {
            String plain = ChartFixtures.read(tmp.resolve("out/original/mychart/templates").resolve(template));
            String marked = ChartFixtures.read(tmp.resolve("out/instrumented/mychart/templates").resolve(template));
            assertTrue(marked.contains(Markers.MARKER_PREFIX), template);

            JsonNode expected = YAML.readTree(plain);
            JsonNode actual = YAML.readTree(withoutMarkers(marked));
            assertEquals(expected, actual, template);
        }

        String script = YAML.readTree(ChartFixtures.read(tmp.resolve("out/instrumented/mychart/templates/configmap.yaml")))
            .path("data").path("script.sh").asText();
        assertTrue(script.startsWith("#!/bin/sh\n" + Markers.MARKER_PREFIX));
    }

    private static String withoutMarkers(String content) {
        return List.of(content.split("\n", -1)).stream()
            .filter(line -> !line.contains(Markers.MARKER_PREFIX))
            .collect(Collectors.joining("\n"));
    }
}

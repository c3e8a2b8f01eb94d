package work.lcod.chartlint.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.chartlint.coverage.CoverageMode;
import work.lcod.chartlint.support.ChartFixtures;
import work.lcod.chartlint.support.FakePolicyEngine;
import work.lcod.chartlint.support.FakeTemplateRenderer;

class LintRunnerTest {
    @TempDir
    Path chart;

    private final FakeTemplateRenderer renderer = new FakeTemplateRenderer();
    private final FakePolicyEngine engine = new FakePolicyEngine();

    @Test
    void fixturesReachingEveryBranchPass() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "full", "debug: true\nextra: true\nverbose: true\n");

        var result = new LintRunner().run(options().build());

        result.assertSucceeded();
        assertEquals(3, result.coverage().expected());
        assertEquals(3, result.coverage().covered());
        assertEquals(List.of("full"), result.fixtures());
        assertEquals(1, engine.invocations().size());
        assertTrue(result.workspace().isEmpty());
    }

    @Test
    void branchesCanBeCoveredByDifferentFixtures() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "debug", "debug: true\n");
        ChartFixtures.fixture(chart, "extras", "extra: true\nverbose: true\n");

        var result = new LintRunner().run(options().build());

        result.assertSucceeded();
        assertEquals(2, renderer.invocations());
        assertEquals(2, engine.invocations().size());
    }

    @Test
    void unreachedBranchIsReportedOnce() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "debug", "debug: true\nextra: true\n");
        ChartFixtures.fixture(chart, "again", "debug: true\n");

        var result = new LintRunner().run(options().build());

        assertFalse(result.succeeded());
        assertEquals(LintResult.Status.FAILURE, result.status());
        assertEquals(1, result.failures().size());
        var failure = result.failures(LintFailure.Category.COVERAGE).get(0);
        assertEquals("templates/configmap.yaml:11", failure.subject());
        assertTrue(failure.message().contains("{{- if .Values.verbose }}"));
        assertThrows(AssertionError.class, result::assertSucceeded);
    }

    @Test
    void originalChartIsNotInstrumented() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "full", "debug: true\nextra: true\nverbose: true\n");

        new LintRunner().run(options().build());

        assertEquals(ChartFixtures.CONFIGMAP, ChartFixtures.read(chart.resolve("templates/configmap.yaml")));
        assertEquals(ChartFixtures.DEPLOYMENT, ChartFixtures.read(chart.resolve("templates/deployment.yaml")));
    }

    @Test
    void writingExceptionsMakesTheNextRunPass() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "debug", "debug: true\nextra: true\n");

        var first = new LintRunner().run(options().writeExceptions(true).build());

        first.assertSucceeded();
        assertEquals(CoverageMode.WRITE_EXCEPTIONS, first.coverage().mode());
        assertEquals(List.of("templates/configmap.yaml"), first.coverage().rewrittenFiles());
        String annotated = ChartFixtures.read(chart.resolve("templates/configmap.yaml"));
        assertTrue(annotated.contains("    # chartlint:ignore\n    {{- if .Values.verbose }}"));

        var second = new LintRunner().run(options().build());

        second.assertSucceeded();
        assertEquals(2, second.coverage().expected());
        assertEquals(annotated, ChartFixtures.read(chart.resolve("templates/configmap.yaml")));
    }

    @Test
    void environmentVariableSelectsExceptionWriting() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "none", "replicas: 2\n");

        var result = new LintRunner().run(options().environment(name -> LintOptions.WRITE_EXCEPTIONS_ENV.equals(name) ? "true" : null).build());

        result.assertSucceeded();
        assertEquals(3, result.coverage().uncovered().size());
        assertEquals(List.of("templates/configmap.yaml", "templates/deployment.yaml"), result.coverage().rewrittenFiles());
    }

    @Test
    void policyViolationFailsTheRun() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "full", "debug: true\nextra: true\nverbose: true\n");
        ChartFixtures.write(chart.resolve("strict/no-debug.rego"), "deny: --debug\n");

        var result = new LintRunner().run(options().policiesDir("strict").build());

        assertEquals(1, result.failures().size());
        var failure = result.failures(LintFailure.Category.POLICY).get(0);
        assertEquals("full", failure.subject());
        assertTrue(failure.message().contains("Conftest failure (full)"));
    }

    @Test
    void renderFailureAbortsBeforePolicies() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "good", "debug: true\n");
        ChartFixtures.fixture(chart, "bad", "debug: true\n");
        var failing = new FakeTemplateRenderer(Set.of("bad"));

        var result = new LintRunner().run(options().renderer(failing).build());

        assertFalse(result.succeeded());
        assertEquals(2, failing.invocations());
        assertEquals(2, result.failures(LintFailure.Category.RENDER).size());
        assertTrue(result.failures(LintFailure.Category.COVERAGE).isEmpty());
        assertTrue(engine.invocations().isEmpty());
    }

    @Test
    void missingChartIsASetupFailure() {
        var result = new LintRunner().run(options().chartDir(chart.resolve("absent")).fixturesDir(chart.toString()).build());

        assertEquals(1, result.failures().size());
        assertEquals(LintFailure.Category.SETUP, result.failures().get(0).category());
    }

    @Test
    void nestedViolationIsReportedOnce() {
        ChartFixtures.nestedChart(chart);

        var result = new LintRunner().run(options().recurseConfigMap(ChartFixtures.NESTED_MANIFEST, "nested-policies").build());

        assertEquals(1, result.failures().size());
        var failure = result.failures(LintFailure.Category.POLICY).get(0);
        assertEquals("default -> configmap:" + ChartFixtures.NESTED_MANIFEST, failure.subject());
        assertEquals(2, engine.invocations().size());
    }

    @Test
    void recursionInheritsTopLevelPolicies() {
        ChartFixtures.nestedChart(chart);

        var result = new LintRunner().run(options()
            .policiesDir("nested-policies")
            .recurseConfigMap(ChartFixtures.NESTED_MANIFEST, null)
            .build());

        assertEquals(2, result.failures(LintFailure.Category.POLICY).size());
        assertTrue(engine.invocations().stream().allMatch(call -> call.policiesDir().equals(chart.resolve("nested-policies"))));
    }

    @Test
    void observersSeeEveryRenderedOutput() {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "a", "debug: true\nextra: true\nverbose: true\n");
        ChartFixtures.fixture(chart, "b", "debug: false\n");
        var seen = new ConcurrentLinkedQueue<String>();

        var result = new LintRunner().run(options()
            .observer(dir -> seen.add(dir.getFileName().toString()))
            .observer(dir -> assertTrue(Files.readString(dir.resolve("mychart/templates/deployment.yaml")).contains("--debug")))
            .build());

        assertEquals(Set.of("a", "b"), Set.copyOf(seen));
        var failures = result.failures(LintFailure.Category.OBSERVER);
        assertEquals(1, failures.size());
        assertEquals("b", failures.get(0).subject());
    }

    @Test
    void preservedWorkspaceKeepsRenderedOutput() throws Exception {
        ChartFixtures.simpleChart(chart);
        ChartFixtures.fixture(chart, "full", "debug: true\nextra: true\nverbose: true\n");

        var result = new LintRunner().run(options().preserve(true).build());

        Path root = result.workspace().orElseThrow();
        assertTrue(Files.isRegularFile(root.resolve("results/full/mychart/templates/deployment.yaml")));
        assertTrue(result.toPrettyJson().contains(root.toString()));
        ChartFixtures.deleteTree(root);
    }

    private LintOptions.Builder options() {
        return LintOptions.builder()
            .chartDir(chart)
            .concurrency(2)
            .renderer(renderer)
            .policyEngine(engine)
            .environment(name -> null);
    }
}

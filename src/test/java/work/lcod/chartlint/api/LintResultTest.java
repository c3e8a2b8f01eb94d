package work.lcod.chartlint.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.chartlint.coverage.CoverageMode;
import work.lcod.chartlint.coverage.CoverageReport;
import work.lcod.chartlint.instrument.Declaration;

class LintResultTest {
    @Test
    void serializesCoverageAndFailures() throws Exception {
        var uncovered = new Declaration("templates/a.yaml", 2, "{{- if .Values.a }}");
        var coverage = new CoverageReport(CoverageMode.VERIFY, 2, 1, List.of(uncovered), List.of());
        var failure = LintFailure.of(LintFailure.Category.COVERAGE, uncovered.location(), "not found");

        var result = LintResult.of(coverage, List.of(failure), List.of("prod"), Optional.empty(), Instant.now());

        assertEquals(1, result.status().exitCode());
        JsonNode json = new ObjectMapper().readTree(result.toPrettyJson());
        assertEquals("failure", json.path("status").asText());
        assertEquals("templates/a.yaml:3", json.path("coverage").path("uncovered").get(0).asText());
        assertEquals("coverage", json.path("failures").get(0).path("category").asText());
        assertTrue(json.path("workspace").isMissingNode());
    }

    @Test
    void assertionListsEveryFailure() {
        var result = LintResult.of(
            CoverageReport.empty(CoverageMode.VERIFY),
            List.of(
                LintFailure.of(LintFailure.Category.POLICY, "prod", "Conftest failure (prod)"),
                LintFailure.of(LintFailure.Category.RENDER, "dev", "broken")
            ),
            List.of("prod", "dev"),
            Optional.empty(),
            Instant.now()
        );

        var error = assertThrows(AssertionError.class, result::assertSucceeded);
        assertEquals("FAIL:\n  [policy] prod: Conftest failure (prod)\n  [render] dev: broken", error.getMessage());
    }

    @Test
    void logLevelParsing() {
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}

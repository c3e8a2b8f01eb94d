package work.lcod.chartlint.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.chartlint.coverage.CoverageReport;

/**
 * Outcome of a {@link LintRunner} execution (usable by the CLI and by tests embedding the linter).
 */
public record LintResult(
    Status status,
    CoverageReport coverage,
    List<LintFailure> failures,
    List<String> fixtures,
    Optional<Path> workspace,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public LintResult {
        failures = List.copyOf(failures);
        fixtures = List.copyOf(fixtures);
    }

    public static LintResult of(CoverageReport coverage, List<LintFailure> failures, List<String> fixtures, Optional<Path> workspace, Instant startedAt) {
        Status status = failures.isEmpty() ? Status.SUCCESS : Status.FAILURE;
        return new LintResult(status, coverage, failures, fixtures, workspace, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public List<LintFailure> failures(LintFailure.Category category) {
        return failures.stream().filter(f -> f.category() == category).collect(Collectors.toList());
    }

    /**
     * Throws an {@link AssertionError} listing every failure. Meant for chart test suites.
     */
    public void assertSucceeded() {
        if (succeeded()) {
            return;
        }
        String report = failures.stream().map(LintFailure::describe).collect(Collectors.joining("\n  ", "FAIL:\n  ", ""));
        throw new AssertionError(report);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("fixtures", fixtures);
        serializable.put("coverage", coverage.toSerializableMap());
        serializable.put("failures", failures.stream().map(LintFailure::toSerializableMap).collect(Collectors.toList()));
        workspace.ifPresent(dir -> serializable.put("workspace", dir.toString()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}

package work.lcod.chartlint.runtime;

import java.util.ArrayList;
import java.util.List;
import work.lcod.chartlint.api.LintFailure;

/**
 * Accumulates failures reported concurrently by the stages of a run.
 */
public final class FailureCollector {
    private final List<LintFailure> failures = new ArrayList<>();

    public void add(LintFailure failure) {
        synchronized (failures) {
            failures.add(failure);
        }
    }

    public void add(LintFailure.Category category, String subject, String message) {
        add(LintFailure.of(category, subject, message));
    }

    public List<LintFailure> snapshot() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public boolean isEmpty() {
        synchronized (failures) {
            return failures.isEmpty();
        }
    }

    public int count(LintFailure.Category category) {
        synchronized (failures) {
            return (int) failures.stream().filter(f -> f.category() == category).count();
        }
    }
}

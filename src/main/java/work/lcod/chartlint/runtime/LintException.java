package work.lcod.chartlint.runtime;

import work.lcod.chartlint.api.LintFailure;

/**
 * Aborts a lint run. Carries the failure category so the runner can report it.
 */
public final class LintException extends RuntimeException {
    private final LintFailure.Category category;

    public LintException(LintFailure.Category category, String message) {
        super(message);
        this.category = category;
    }

    public LintException(LintFailure.Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public LintFailure.Category category() {
        return category;
    }
}

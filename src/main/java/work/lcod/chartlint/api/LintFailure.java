package work.lcod.chartlint.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One reported problem of a lint run. {@code subject} names what failed (a fixture, a file location, a rule).
 */
public record LintFailure(Category category, String subject, String message) {
    public LintFailure {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public static LintFailure of(Category category, String subject, String message) {
        return new LintFailure(category, subject, message);
    }

    public boolean isFatal() {
        return category.fatal();
    }

    public String describe() {
        return "[" + category.name().toLowerCase() + "] " + subject + ": " + message;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("category", category.name().toLowerCase());
        map.put("subject", subject);
        map.put("message", message);
        return map;
    }

    public enum Category {
        SETUP(true),
        INSTRUMENTATION(true),
        RENDER(true),
        SCAN(false),
        COVERAGE(false),
        POLICY(false),
        RECURSION(false),
        OBSERVER(false);

        private final boolean fatal;

        Category(boolean fatal) {
            this.fatal = fatal;
        }

        public boolean fatal() {
            return fatal;
        }
    }
}

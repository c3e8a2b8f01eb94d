package work.lcod.chartlint.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.chartlint.coverage.CoverageMode;
import work.lcod.chartlint.policy.ConftestPolicyEngine;
import work.lcod.chartlint.policy.PolicyEngine;
import work.lcod.chartlint.recursion.ConfigMapExtraction;
import work.lcod.chartlint.recursion.ExtractionFunction;
import work.lcod.chartlint.recursion.RecursionRule;
import work.lcod.chartlint.render.HelmRenderer;
import work.lcod.chartlint.render.TemplateRenderer;

/**
 * Immutable, finalized configuration of a lint run. All paths are absolute.
 */
public record LintOptions(
    Path chartDir,
    List<Path> fixturesDirs,
    Path policiesDir,
    int concurrency,
    boolean writeExceptions,
    boolean preserve,
    List<RecursionRule> recursions,
    List<RenderObserver> observers,
    TemplateRenderer renderer,
    PolicyEngine policyEngine
) {
    /** Setting this environment variable to {@code true} turns on exception writing. */
    public static final String WRITE_EXCEPTIONS_ENV = "CHARTLINT_WRITE_EXCEPTIONS";
    public static final String DEFAULT_FIXTURES_DIR = "fixtures";
    public static final String DEFAULT_POLICIES_DIR = "policies";

    public LintOptions {
        Objects.requireNonNull(chartDir, "chartDir");
        Objects.requireNonNull(policiesDir, "policiesDir");
        Objects.requireNonNull(renderer, "renderer");
        Objects.requireNonNull(policyEngine, "policyEngine");
        fixturesDirs = List.copyOf(fixturesDirs);
        recursions = List.copyOf(recursions);
        observers = List.copyOf(observers);
        if (fixturesDirs.isEmpty()) {
            throw new IllegalArgumentException("At least one fixtures directory is required.");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public CoverageMode coverageMode() {
        return writeExceptions ? CoverageMode.WRITE_EXCEPTIONS : CoverageMode.VERIFY;
    }

    /**
     * Actions run for every rendered output: the top-level policy check, the observers, then one
     * recursive descent per rule.
     */
    public List<PostRenderAction> postRenderActions() {
        List<PostRenderAction> actions = new ArrayList<>();
        actions.add(PostRenderAction.policyCheck(policiesDir));
        observers.forEach(observer -> actions.add(PostRenderAction.observe(observer)));
        recursions.forEach(rule -> actions.add(PostRenderAction.recursiveDescent(rule)));
        return actions;
    }

    public static int defaultConcurrency() {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    public static final class Builder {
        private Path chartDir;
        private final List<String> fixturesDirs = new ArrayList<>();
        private String policiesDir;
        private int concurrency;
        private boolean writeExceptions;
        private boolean preserve;
        private final List<RuleSpec> recursions = new ArrayList<>();
        private final List<RenderObserver> observers = new ArrayList<>();
        private TemplateRenderer renderer;
        private PolicyEngine policyEngine;
        private Function<String, String> environment = System::getenv;

        public Builder chartDir(Path chartDir) {
            this.chartDir = chartDir;
            return this;
        }

        public Builder chartDir(String chartDir) {
            return chartDir(Paths.get(chartDir));
        }

        /** Adds a fixtures directory; relative paths resolve against the chart directory. */
        public Builder fixturesDir(String dir) {
            this.fixturesDirs.add(dir);
            return this;
        }

        /** Replaces every fixtures directory configured so far. */
        public Builder fixturesDirs(List<String> dirs) {
            this.fixturesDirs.clear();
            this.fixturesDirs.addAll(dirs);
            return this;
        }

        public Builder policiesDir(String policiesDir) {
            this.policiesDir = policiesDir;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /** Rewrites the chart to ignore every branch the fixtures do not reach. */
        public Builder writeExceptions(boolean writeExceptions) {
            this.writeExceptions = writeExceptions;
            return this;
        }

        /** Keeps the temporary directory after the run instead of deleting it. */
        public Builder preserve(boolean preserve) {
            this.preserve = preserve;
            return this;
        }

        /** Recursion checked with the top-level policies directory. */
        public Builder recursion(ExtractionFunction extraction) {
            return recursion(null, extraction, null);
        }

        public Builder recursion(ExtractionFunction extraction, String policiesDir) {
            return recursion(null, extraction, policiesDir);
        }

        public Builder recursion(String name, ExtractionFunction extraction, String policiesDir) {
            this.recursions.add(new RuleSpec(name, Objects.requireNonNull(extraction, "extraction"), policiesDir));
            return this;
        }

        public Builder recurseConfigMap(String manifestPath, String policiesDir) {
            var extraction = ConfigMapExtraction.of(manifestPath);
            return recursion(extraction.toString(), extraction, policiesDir);
        }

        public Builder observer(RenderObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder renderer(TemplateRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder policyEngine(PolicyEngine policyEngine) {
            this.policyEngine = policyEngine;
            return this;
        }

        public Builder environment(Function<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        /**
         * Applies defaults and resolves paths. Recursion rules without their own policies directory
         * use the top-level one; each rule's directory is resolved independently.
         */
        public LintOptions build() {
            Path chart = (chartDir == null ? Paths.get("") : chartDir).toAbsolutePath().normalize();

            List<Path> fixtures = new ArrayList<>();
            if (fixturesDirs.isEmpty()) {
                fixtures.add(chartRelative(chart, null, DEFAULT_FIXTURES_DIR));
            }
            for (String dir : fixturesDirs) {
                fixtures.add(chartRelative(chart, dir, DEFAULT_FIXTURES_DIR));
            }

            List<RecursionRule> rules = new ArrayList<>();
            for (int i = 0; i < recursions.size(); i++) {
                RuleSpec spec = recursions.get(i);
                String name = spec.name() != null ? spec.name() : "recursion-" + (i + 1);
                String rulePolicies = spec.policiesDir() != null ? spec.policiesDir() : policiesDir;
                rules.add(new RecursionRule(name, spec.extraction(), chartRelative(chart, rulePolicies, DEFAULT_POLICIES_DIR)));
            }

            boolean exceptions = writeExceptions || "true".equals(environment.apply(WRITE_EXCEPTIONS_ENV));

            return new LintOptions(
                chart,
                fixtures,
                chartRelative(chart, policiesDir, DEFAULT_POLICIES_DIR),
                concurrency > 0 ? concurrency : defaultConcurrency(),
                exceptions,
                preserve,
                rules,
                observers,
                renderer != null ? renderer : new HelmRenderer(),
                policyEngine != null ? policyEngine : new ConftestPolicyEngine()
            );
        }

        private static Path chartRelative(Path chart, String path, String defaultPath) {
            String value = path == null || path.isBlank() ? defaultPath : path;
            Path candidate = Paths.get(value);
            if (!candidate.isAbsolute()) {
                candidate = chart.resolve(candidate);
            }
            return candidate.toAbsolutePath().normalize();
        }

        private record RuleSpec(String name, ExtractionFunction extraction, String policiesDir) {}
    }
}

package work.lcod.chartlint.api;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.chartlint.policy.PolicyRunner;
import work.lcod.chartlint.recursion.RecursionController;
import work.lcod.chartlint.recursion.RecursionRule;
import work.lcod.chartlint.runtime.RunContext;
import work.lcod.chartlint.runtime.TaskGroup;

/**
 * Work applied to every rendered output directory once rendering is complete. The variants are
 * {@link PolicyCheck}, {@link RecursiveDescent} and {@link Observe}; each records its own failures.
 */
public interface PostRenderAction {
    void apply(RunContext ctx, Path renderedDir) throws InterruptedException;

    String describe();

    static PostRenderAction policyCheck(Path policiesDir) {
        return new PolicyCheck(policiesDir);
    }

    static PostRenderAction recursiveDescent(RecursionRule rule) {
        return new RecursiveDescent(rule);
    }

    static PostRenderAction observe(RenderObserver observer) {
        return new Observe(observer);
    }

    record PolicyCheck(Path policiesDir) implements PostRenderAction {
        public PolicyCheck {
            Objects.requireNonNull(policiesDir, "policiesDir");
        }

        @Override
        public void apply(RunContext ctx, Path renderedDir) throws InterruptedException {
            String label = String.valueOf(renderedDir.getFileName());
            PolicyRunner.check(ctx.options().policyEngine(), policiesDir, renderedDir, label, ctx.failures());
        }

        @Override
        public String describe() {
            return "policy " + policiesDir;
        }
    }

    record RecursiveDescent(RecursionRule rule) implements PostRenderAction {
        public RecursiveDescent {
            Objects.requireNonNull(rule, "rule");
        }

        @Override
        public void apply(RunContext ctx, Path renderedDir) throws InterruptedException {
            RecursionController.descend(rule, renderedDir, ctx.workspace(), ctx.options().policyEngine(), ctx.failures());
        }

        @Override
        public String describe() {
            return "recursion " + rule.name();
        }
    }

    record Observe(RenderObserver observer) implements PostRenderAction {
        public Observe {
            Objects.requireNonNull(observer, "observer");
        }

        @Override
        public void apply(RunContext ctx, Path renderedDir) {
            try {
                observer.visit(renderedDir);
            } catch (Exception | AssertionError ex) {
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                ctx.failures().add(LintFailure.Category.OBSERVER, String.valueOf(renderedDir.getFileName()), TaskGroup.messageOf(ex));
            }
        }

        @Override
        public String describe() {
            return "observer";
        }
    }
}

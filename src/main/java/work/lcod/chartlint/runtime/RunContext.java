package work.lcod.chartlint.runtime;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import work.lcod.chartlint.api.LintOptions;

/**
 * State of a single lint run, passed explicitly to every stage: options, the bounded worker pool,
 * the workspace and the failure collector.
 */
public final class RunContext implements AutoCloseable {
    private final LintOptions options;
    private final Workspace workspace;
    private final FailureCollector failures;
    private final ExecutorService pool;

    public RunContext(LintOptions options, Workspace workspace, FailureCollector failures) {
        this.options = Objects.requireNonNull(options, "options");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.failures = Objects.requireNonNull(failures, "failures");
        this.pool = Executors.newFixedThreadPool(options.concurrency(), new WorkerThreadFactory());
    }

    public LintOptions options() {
        return options;
    }

    public Workspace workspace() {
        return workspace;
    }

    public FailureCollector failures() {
        return failures;
    }

    public TaskGroup newGroup() {
        return TaskGroup.on(pool);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "chartlint-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

package work.lcod.chartlint.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import work.lcod.chartlint.api.LintFailure;

/**
 * A batch of independent units of work submitted to the run's shared pool and awaited together.
 * <p>
 * An inline group runs every task on the submitting thread; nested work started from inside a pool
 * task uses one so it never waits on tasks queued behind it.
 */
public final class TaskGroup {
    private final ExecutorService executor;
    private final List<Future<?>> pending = new ArrayList<>();
    private final List<Throwable> inlineFailures = new ArrayList<>();

    private TaskGroup(ExecutorService executor) {
        this.executor = executor;
    }

    public static TaskGroup on(ExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor is required");
        }
        return new TaskGroup(executor);
    }

    public static TaskGroup inline() {
        return new TaskGroup(null);
    }

    public boolean isInline() {
        return executor == null;
    }

    public synchronized void submit(Task task) {
        if (executor == null) {
            try {
                task.run();
            } catch (Exception ex) {
                inlineFailures.add(ex);
            }
            return;
        }
        pending.add(executor.submit(() -> {
            task.run();
            return null;
        }));
    }

    /**
     * Blocks until every submitted task finished and returns their failures in submission order.
     * The group is empty afterwards and may be reused.
     */
    public List<Throwable> await() {
        List<Future<?>> futures;
        List<Throwable> failures;
        synchronized (this) {
            futures = new ArrayList<>(pending);
            failures = new ArrayList<>(inlineFailures);
            pending.clear();
            inlineFailures.clear();
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                failures.add(ex.getCause() != null ? ex.getCause() : ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new LintException(LintFailure.Category.SETUP, "Interrupted while waiting for tasks", ex);
            }
        }
        return failures;
    }

    /**
     * Awaits the group and aborts the run with the first failure, if any.
     */
    public void awaitOrAbort(LintFailure.Category category, String stage) {
        List<Throwable> failures = await();
        if (failures.isEmpty()) {
            return;
        }
        Throwable first = failures.get(0);
        if (first instanceof LintException lint) {
            throw lint;
        }
        throw new LintException(category, stage + ": " + messageOf(first), first);
    }

    public static String messageOf(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }
}

package work.lcod.chartlint.api;

import java.nio.file.Path;

/**
 * Called once per fixture with the rendered output directory. Observers may run concurrently;
 * throwing (an exception or an assertion error) reports an observer failure.
 */
@FunctionalInterface
public interface RenderObserver {
    void visit(Path renderedDir) throws Exception;
}

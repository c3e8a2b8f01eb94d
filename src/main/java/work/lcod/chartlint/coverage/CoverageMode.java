package work.lcod.chartlint.coverage;

/**
 * What the reconciler does with branches no fixture reached.
 */
public enum CoverageMode {
    /** Report every uncovered branch as a failure. */
    VERIFY,
    /** Annotate every uncovered branch in the source chart so later runs skip it. */
    WRITE_EXCEPTIONS
}

package work.lcod.chartlint.instrument;

/**
 * Comment syntax shared by the injector, the scanner and the exception writer.
 */
public final class Markers {
    /** Prefix of an injected trace comment; the token follows it. */
    public static final String MARKER_PREFIX = "# chartlint: ";
    /** Excludes the branch on the same line, or on the line right below, from coverage. */
    public static final String SUPPRESSION = "chartlint:ignore";
    public static final String SUPPRESSION_COMMENT = "# " + SUPPRESSION;

    private Markers() {}

    public static String marker(String token) {
        return MARKER_PREFIX + token;
    }
}

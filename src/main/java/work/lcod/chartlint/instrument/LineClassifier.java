package work.lcod.chartlint.instrument;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds conditional-branch declarations in template lines and the column a follower line must use.
 */
public final class LineClassifier {
    private static final Pattern CONDITIONAL = Pattern.compile("\\{\\{-?\\s*if");

    private LineClassifier() {}

    /**
     * A line declares a branch when it opens an {@code if} action and neither it nor the line above
     * carries the suppression annotation.
     */
    public static boolean isDeclaration(List<String> lines, int index) {
        String line = lines.get(index);
        if (!CONDITIONAL.matcher(line).find() || line.contains(Markers.SUPPRESSION)) {
            return false;
        }
        return index == 0 || !lines.get(index - 1).contains(Markers.SUPPRESSION);
    }

    /**
     * Indentation for a line inserted after {@code index}. Inside a block scalar the inserted line has
     * to stay part of the scalar body, so the nearest {@code |} opener above wins (its indent + 2).
     */
    public static int indentation(List<String> lines, int index) {
        for (int i = index; i >= 0; i--) {
            String line = lines.get(i);
            if (line.trim().endsWith("|")) {
                return leadingSpaces(line) + 2;
            }
        }
        return leadingSpaces(lines.get(index));
    }

    public static String indent(int columns) {
        return " ".repeat(columns);
    }

    static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }
}

package work.lcod.chartlint.coverage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.chartlint.instrument.Declaration;

public record CoverageReport(CoverageMode mode, int expected, int covered, List<Declaration> uncovered, List<String> rewrittenFiles) {
    public CoverageReport {
        uncovered = List.copyOf(uncovered);
        rewrittenFiles = List.copyOf(rewrittenFiles);
    }

    public static CoverageReport empty(CoverageMode mode) {
        return new CoverageReport(mode, 0, 0, List.of(), List.of());
    }

    public double ratio() {
        return expected == 0 ? 1.0 : (double) covered / expected;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("mode", mode.name().toLowerCase());
        map.put("expected", expected);
        map.put("covered", covered);
        map.put("uncovered", uncovered.stream().map(Declaration::location).collect(Collectors.toList()));
        map.put("rewrittenFiles", rewrittenFiles);
        return map;
    }
}

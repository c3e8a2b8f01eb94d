package work.lcod.chartlint.cli;

import java.util.List;
import picocli.CommandLine;

/**
 * Reports the linter build and the external tools it shells out to.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final List<String> TOOLS = List.of("helm", "conftest");

    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "chartlint (java) " + (implementationVersion != null ? implementationVersion : "development"),
            "runtime: Java " + Runtime.version().feature() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")",
            "requires on PATH: " + String.join(", ", TOOLS)
        };
    }
}

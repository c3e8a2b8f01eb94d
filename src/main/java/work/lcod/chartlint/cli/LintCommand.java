package work.lcod.chartlint.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.chartlint.api.LintConfigFile;
import work.lcod.chartlint.api.LintFailure;
import work.lcod.chartlint.api.LintOptions;
import work.lcod.chartlint.api.LintResult;
import work.lcod.chartlint.api.LintRunner;
import work.lcod.chartlint.api.LogLevel;
import work.lcod.chartlint.policy.ConftestPolicyEngine;
import work.lcod.chartlint.render.HelmRenderer;

@CommandLine.Command(
    name = "chartlint",
    description = "Check that fixtures cover every conditional branch of a Helm chart and that the rendered manifests pass policy checks.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LintCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "CHART",
        description = "Chart directory to lint.",
        defaultValue = "."
    )
    private String chartDir;

    @CommandLine.Option(
        names = {"-f", "--fixtures-dir"},
        description = "Fixtures directory, relative to the chart (repeatable; default: fixtures)."
    )
    private List<String> fixturesDirs = new ArrayList<>();

    @CommandLine.Option(
        names = {"-p", "--policies-dir"},
        description = "Conftest policies directory, relative to the chart (default: policies).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String policiesDir;

    @CommandLine.Option(
        names = {"-j", "--concurrency"},
        description = "Worker threads (default: twice the available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer concurrency;

    @CommandLine.Option(
        names = "--write-exceptions",
        description = "Add ignore comments to the chart for every uncovered branch instead of failing."
    )
    private boolean writeExceptions;

    @CommandLine.Option(
        names = "--preserve",
        description = "Keep the temporary directory and print its location."
    )
    private boolean preserve;

    @CommandLine.Option(
        names = "--recurse-configmap",
        paramLabel = "MANIFEST",
        description = "Rendered ConfigMap (e.g. mychart/templates/configmap.yaml) whose data entries are linted as manifests (repeatable)."
    )
    private List<String> recurseConfigMaps = new ArrayList<>();

    @CommandLine.Option(
        names = "--recursion-policies-dir",
        description = "Policies for --recurse-configmap rules (default: the top-level policies).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String recursionPoliciesDir;

    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (default: <chart>/" + LintConfigFile.DEFAULT_NAME + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configFile;

    @CommandLine.Option(
        names = "--json",
        description = "Print the result as JSON."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--helm",
        description = "Helm executable.",
        defaultValue = HelmRenderer.DEFAULT_EXECUTABLE
    )
    private String helm;

    @CommandLine.Option(
        names = "--conftest",
        description = "Conftest executable.",
        defaultValue = ConftestPolicyEngine.DEFAULT_EXECUTABLE
    )
    private String conftest;

    @Override
    public Integer call() {
        LogLevel.from(logLevelRaw).apply();

        Path chart = Paths.get(chartDir).toAbsolutePath().normalize();
        LintOptions.Builder builder = LintOptions.builder().chartDir(chart);
        loadConfigFile(chart).ifPresent(config -> config.applyTo(builder));
        applyOverrides(builder);

        LintResult result = new LintRunner().run(builder.build());
        print(result, spec.commandLine().getOut());
        return result.status().exitCode();
    }

    private Optional<LintConfigFile> loadConfigFile(Path chart) {
        if (configFile == null || configFile.isBlank()) {
            return LintConfigFile.discover(chart);
        }
        Path path = Paths.get(configFile).toAbsolutePath();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + path);
        }
        return Optional.of(LintConfigFile.load(path));
    }

    private void applyOverrides(LintOptions.Builder builder) {
        if (!fixturesDirs.isEmpty()) {
            builder.fixturesDirs(fixturesDirs);
        }
        if (policiesDir != null) {
            builder.policiesDir(policiesDir);
        }
        if (concurrency != null) {
            if (concurrency < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--concurrency must be at least 1");
            }
            builder.concurrency(concurrency);
        }
        if (writeExceptions) {
            builder.writeExceptions(true);
        }
        if (preserve) {
            builder.preserve(true);
        }
        for (String manifest : recurseConfigMaps) {
            builder.recurseConfigMap(manifest, recursionPoliciesDir);
        }
        builder.renderer(new HelmRenderer(helm));
        builder.policyEngine(new ConftestPolicyEngine(conftest));
    }

    private void print(LintResult result, PrintWriter out) {
        if (json) {
            out.println(result.toPrettyJson());
            out.flush();
            return;
        }
        var coverage = result.coverage();
        out.printf("%d/%d branches covered by %d fixture(s)%n", coverage.covered(), coverage.expected(), result.fixtures().size());
        if (!coverage.rewrittenFiles().isEmpty()) {
            out.println("exceptions written to:");
            coverage.rewrittenFiles().forEach(file -> out.println("  " + file));
        }
        result.workspace().ifPresent(dir -> out.println("temporary directory preserved at " + dir));
        if (result.succeeded()) {
            out.println("OK");
        } else {
            out.println("FAIL:");
            for (LintFailure failure : result.failures()) {
                out.println("  " + failure.describe());
            }
        }
        out.flush();
    }
}

package io.disposescan;

import io.disposescan.bytecode.BytecodeScanner;
import io.disposescan.config.RuleConfig;
import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.Finding;
import io.disposescan.model.ScanReport;
import io.disposescan.model.Severity;
import io.disposescan.report.ConsoleReporter;
import io.disposescan.report.JsonReporter;
import io.disposescan.report.Reporter;
import io.disposescan.rules.AnalysisContext;
import io.disposescan.rules.RuleRegistry;
import io.disposescan.rules.RuleRunner;
import io.disposescan.rules.RunStatistics;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the dispose-scan tool.
 */
@Command(
        name = "dispose-scan",
        mixinStandardHelpOptions = true,
        version = "dispose-scan 1.0.0",
        description = "Finds public methods of AutoCloseable types that keep using their state after close().",
        footer = {
                "",
                "Examples:",
                "  dispose-scan target/classes",
                "  dispose-scan build/libs/app.jar --output-format json --output-file report.json",
                "  dispose-scan target/classes --config dispose-scan.yaml --fail-on high"
        }
)
public class DisposeScanCli implements Callable<Integer> {

    private static final String PROJECT_CONFIG = "dispose-scan.yaml";

    @Parameters(
            arity = "1..*",
            description = "Class directories and JAR files to scan"
    )
    private List<Path> paths;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to ./" + PROJECT_CONFIG + " when present)"
    )
    private Path configFile;

    @Option(
            names = {"-x", "--exclude"},
            description = "Glob patterns of classes not to scan (e.g., '**.generated.**', 'com.example.Legacy*')",
            split = ","
    )
    private List<String> excludePatterns;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if there are findings at this level or higher: critical, high, medium, low, audit",
            defaultValue = "medium"
    )
    private String failOnLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"--sequential"},
            description = "Analyze methods on a single thread"
    )
    private boolean sequential;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        Instant startTime = Instant.now();

        try {
            for (Path path : paths) {
                if (!Files.exists(path)) {
                    System.err.println("Error: Path does not exist: " + path);
                    return 1;
                }
            }

            Severity failLevel;
            try {
                failLevel = Severity.parse(failOnLevel);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: Invalid value for --fail-on: " + failOnLevel);
                System.err.println("Valid values: critical, high, medium, low, audit");
                return 1;
            }

            RuleConfig config = loadConfig();

            // Step 1: Read bytecode
            log("Scanning bytecode...");
            List<String> excludes = new ArrayList<>(config.excludeClasses());
            if (excludePatterns != null) {
                excludes.addAll(excludePatterns);
            }
            BytecodeScanner scanner = new BytecodeScanner(excludes);
            ClassPool pool = scanner.scan(paths);

            log("  Read " + scanner.getClassesScanned() + " classes from " +
                    scanner.getJarsScanned() + " JARs" +
                    (scanner.getClassesFailed() > 0 ? " (" + scanner.getClassesFailed() + " unreadable)" : ""));

            // Step 2: Run rules
            log("Checking methods...");
            AnalysisContext context = AnalysisContext.of(pool, config);
            RuleRunner runner = new RuleRunner(RuleRegistry.createDefault().enabledRules(), !sequential);
            List<Finding> findings = runner.run(pool, context);
            RunStatistics statistics = runner.statistics();

            log("  Checked " + statistics.methodsAnalyzed() + " methods, " +
                    findings.size() + " findings, " + statistics.methodsSkipped() + " skipped");

            // Step 3: Report
            ScanReport report = ScanReport.builder()
                    .scannedPaths(paths.stream().map(Path::toAbsolutePath).toList())
                    .scanStartTime(startTime)
                    .scanDuration(Duration.between(startTime, Instant.now()))
                    .classesScanned(scanner.getClassesScanned())
                    .jarsScanned(scanner.getJarsScanned())
                    .methodsAnalyzed(statistics.methodsAnalyzed())
                    .methodsSkipped(statistics.methodsSkipped())
                    .findings(findings)
                    .build();

            writeReport(report, createReporter());

            if (report.hasFindingsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings at " + failLevel + " level or higher.");
                }
                return 2;
            }

            return 0;

        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private RuleConfig loadConfig() throws IOException {
        RuleConfig defaultConfig = RuleConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(RuleConfig.loadFromFile(configFile));
        }

        Path projectConfig = Path.of(PROJECT_CONFIG);
        if (Files.exists(projectConfig)) {
            log("Loading configuration from: " + projectConfig.toAbsolutePath());
            return defaultConfig.merge(RuleConfig.loadFromFile(projectConfig));
        }

        return defaultConfig;
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(ScanReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DisposeScanCli()).execute(args);
        System.exit(exitCode);
    }
}

package io.disposescan.report;

import io.disposescan.model.Finding;
import io.disposescan.model.ScanReport;
import io.disposescan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats scan results for console output with ANSI colors, grouped by class.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final String TREE_BRANCH = "\u251C\u2500\u2500 ";  // ├──
    private static final String TREE_LAST = "\u2514\u2500\u2500 ";    // └──

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(ScanReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        if (!report.findings().isEmpty()) {
            printFindingsByClass(out, report);
        }
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, ScanReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("DISPOSE-SCAN REPORT", 70));
        out.println(line('=', 70));
        out.println();

        String paths = report.scannedPaths().stream()
                .map(Path::toString)
                .collect(Collectors.joining(", "));
        out.println("Scanned: " + (paths.isEmpty() ? "(nothing)" : paths));
        out.println("Scan Date: " + report.scanDate());
        out.println();
    }

    private void printSummary(PrintWriter out, ScanReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        out.println(String.format("Read: %,d classes | %d JARs | %.1fs",
                report.classesScanned(),
                report.jarsScanned(),
                report.scanDurationMs() / 1000.0));
        out.println(String.format("Methods: %,d analyzed | %,d skipped",
                report.methodsAnalyzed(),
                report.methodsSkipped()));

        StringBuilder counts = new StringBuilder("Findings: ");
        Severity[] severities = Severity.values();
        for (int i = 0; i < severities.length; i++) {
            long count = report.countBySeverity(severities[i]);
            String text = count + " " + severities[i].label().toLowerCase();
            counts.append(count > 0 ? color(colorFor(severities[i]), text) : text);
            if (i < severities.length - 1) {
                counts.append(" | ");
            }
        }
        out.println(counts);
        out.println("Affected: " + report.uniqueClassCount() + " classes");
        out.println();
    }

    private void printFindingsByClass(PrintWriter out, ScanReport report) {
        Map<String, List<Finding>> byClass = report.findingsByClass();

        out.println(bold("FINDINGS BY CLASS") + color(CYAN, " (" + byClass.size() + " classes)"));
        out.println(line('=', 70));

        for (Map.Entry<String, List<Finding>> entry : byClass.entrySet()) {
            List<Finding> findings = entry.getValue();
            out.println(bold(entry.getKey()) + color(CYAN, " [" + findings.size() + " findings]"));

            for (int i = 0; i < findings.size(); i++) {
                Finding finding = findings.get(i);
                String prefix = i == findings.size() - 1 ? TREE_LAST : TREE_BRANCH;
                String where = finding.lineNumber() > 0 ? " line " + finding.lineNumber() : "";
                out.println(prefix + color(colorFor(finding.severity()), "[" + finding.severity().label() + "]")
                        + " " + finding.signature() + where
                        + " (" + finding.confidence().name().toLowerCase() + " confidence)");
            }
            out.println();
        }

        Finding sample = report.findings().get(0);
        if (sample.description() != null) {
            out.println(bold("Problem: ") + sample.description());
        }
        if (sample.recommendation() != null) {
            out.println(bold("Fix: ") + sample.recommendation());
        }
        out.println();
    }

    private void printFooter(PrintWriter out, ScanReport report) {
        out.println(line('=', 70));
        if (report.findings().isEmpty()) {
            out.println(color(GREEN, "No issues found."));
        } else {
            out.println(report.totalFindings() + " issue(s) found.");
        }
    }

    private String colorFor(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> RED;
            case MEDIUM -> YELLOW;
            case LOW, AUDIT -> CYAN;
        };
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        int padding = Math.max(0, (width - text.length()) / 2);
        return " ".repeat(padding) + text;
    }

    private String bold(String text) {
        return useColors ? BOLD + text + RESET : text;
    }

    private String color(String color, String text) {
        return useColors ? color + text + RESET : text;
    }
}

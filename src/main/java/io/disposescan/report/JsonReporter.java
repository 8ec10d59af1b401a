package io.disposescan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.disposescan.model.Finding;
import io.disposescan.model.ScanReport;
import io.disposescan.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Formats scan results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Callers own the writer, which may wrap System.out
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(ScanReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    private JsonReport toJsonReport(ScanReport report) {
        return new JsonReport(
                new JsonReport.Metadata(
                        report.scannedPaths().stream().map(Path::toString).toList(),
                        report.scanDate(),
                        report.classesScanned(),
                        report.jarsScanned(),
                        report.methodsAnalyzed(),
                        report.methodsSkipped(),
                        report.scanDurationMs()
                ),
                new JsonReport.Summary(
                        report.countBySeverity(Severity.CRITICAL),
                        report.countBySeverity(Severity.HIGH),
                        report.countBySeverity(Severity.MEDIUM),
                        report.countBySeverity(Severity.LOW),
                        report.countBySeverity(Severity.AUDIT),
                        report.totalFindings()
                ),
                report.findings().stream()
                        .map(this::toJsonFinding)
                        .toList()
        );
    }

    private JsonReport.Finding toJsonFinding(Finding finding) {
        return new JsonReport.Finding(
                finding.className(),
                finding.simpleClassName(),
                finding.methodName(),
                finding.descriptor(),
                finding.signature(),
                finding.lineNumber() > 0 ? finding.lineNumber() : null,
                finding.sourceFile(),
                finding.severity().name(),
                finding.confidence().name(),
                finding.ruleId(),
                finding.description(),
                finding.recommendation()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<Finding> findings
    ) {
        public record Metadata(
                List<String> scannedPaths,
                LocalDateTime scanDate,
                int classesScanned,
                int jarsScanned,
                int methodsAnalyzed,
                int methodsSkipped,
                long scanDurationMs
        ) {}

        public record Summary(
                long critical,
                long high,
                long medium,
                long low,
                long audit,
                int total
        ) {}

        public record Finding(
                String className,
                String simpleClassName,
                String methodName,
                String descriptor,
                String signature,
                Integer lineNumber,
                String sourceFile,
                String severity,
                String confidence,
                String ruleId,
                String description,
                String recommendation
        ) {}
    }
}

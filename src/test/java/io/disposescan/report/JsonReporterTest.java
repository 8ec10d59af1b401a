package io.disposescan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.disposescan.model.Confidence;
import io.disposescan.model.Finding;
import io.disposescan.model.ScanReport;
import io.disposescan.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void write_producesMetadataSummaryAndFindings() throws IOException {
        JsonNode root = mapper.readTree(new JsonReporter(false).toString(sampleReport()));

        assertThat(root.path("metadata").path("classesScanned").asInt()).isEqualTo(3);
        assertThat(root.path("metadata").path("scanDurationMs").asLong()).isEqualTo(250);
        assertThat(root.path("metadata").path("scanDate").isTextual()).isTrue();
        assertThat(root.path("summary").path("medium").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("total").asInt()).isEqualTo(1);

        JsonNode finding = root.path("findings").get(0);
        assertThat(finding.path("className").asText()).isEqualTo("com.example.Writer");
        assertThat(finding.path("simpleClassName").asText()).isEqualTo("Writer");
        assertThat(finding.path("severity").asText()).isEqualTo("MEDIUM");
        assertThat(finding.path("confidence").asText()).isEqualTo("HIGH");
        assertThat(finding.path("ruleId").asText()).isEqualTo("use-disposed-guard-exception");
    }

    @Test
    void write_omitsUnknownLineAndSource() throws IOException {
        JsonNode finding = mapper.readTree(new JsonReporter(false).toString(sampleReport()))
                .path("findings").get(0);

        assertThat(finding.has("lineNumber")).isFalse();
        assertThat(finding.has("sourceFile")).isFalse();
    }

    @Test
    void write_toFile() throws IOException {
        Path output = tempDir.resolve("report.json");

        new JsonReporter().write(sampleReport(), output);

        assertThat(mapper.readTree(Files.readString(output)).path("findings").size()).isEqualTo(1);
    }

    private static ScanReport sampleReport() {
        return ScanReport.builder()
                .scannedPaths(List.of(Path.of("app.jar")))
                .scanStartTime(Instant.parse("2024-05-01T10:00:00Z"))
                .scanDuration(Duration.ofMillis(250))
                .classesScanned(3)
                .jarsScanned(1)
                .methodsAnalyzed(20)
                .findings(List.of(Finding.builder()
                        .className("com.example.Writer")
                        .methodName("write")
                        .descriptor("(I)V")
                        .severity(Severity.MEDIUM)
                        .confidence(Confidence.HIGH)
                        .ruleId("use-disposed-guard-exception")
                        .build()))
                .build();
    }
}

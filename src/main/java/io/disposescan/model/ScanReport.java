package io.disposescan.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete scan report containing all findings and metadata.
 *
 * @param scannedPaths     Class directories and JARs that were scanned
 * @param scanStartTime    When the scan started
 * @param scanDuration     How long the scan took
 * @param classesScanned   Number of classes read
 * @param jarsScanned      Number of JAR files read
 * @param methodsAnalyzed  Number of methods the rules looked at
 * @param methodsSkipped   Number of methods skipped because their body could not be interpreted
 * @param findings         All findings from the scan
 */
public record ScanReport(
        List<Path> scannedPaths,
        Instant scanStartTime,
        Duration scanDuration,
        int classesScanned,
        int jarsScanned,
        int methodsAnalyzed,
        int methodsSkipped,
        List<Finding> findings
) {
    /**
     * Compact constructor with validation.
     */
    public ScanReport {
        scannedPaths = scannedPaths != null ? List.copyOf(scannedPaths) : List.of();
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    /**
     * Returns findings grouped by declaring class, in report order.
     */
    public Map<String, List<Finding>> findingsByClass() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::className, LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Returns true if there are any findings at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity minimum) {
        return findings.stream()
                .anyMatch(f -> f.severity().isAtLeast(minimum));
    }

    public int totalFindings() {
        return findings.size();
    }

    public long countBySeverity(Severity severity) {
        return findings.stream()
                .filter(f -> f.severity() == severity)
                .count();
    }

    /**
     * Returns the number of distinct classes with findings.
     */
    public int uniqueClassCount() {
        return (int) findings.stream()
                .map(Finding::className)
                .distinct()
                .count();
    }

    /**
     * Returns the scan date as LocalDateTime.
     */
    public LocalDateTime scanDate() {
        return scanStartTime != null
                ? LocalDateTime.ofInstant(scanStartTime, ZoneId.systemDefault())
                : LocalDateTime.now();
    }

    /**
     * Returns the scan duration in milliseconds.
     */
    public long scanDurationMs() {
        return scanDuration != null ? scanDuration.toMillis() : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<Path> scannedPaths = List.of();
        private Instant scanStartTime;
        private Duration scanDuration;
        private int classesScanned;
        private int jarsScanned;
        private int methodsAnalyzed;
        private int methodsSkipped;
        private List<Finding> findings = List.of();

        public Builder scannedPaths(List<Path> scannedPaths) {
            this.scannedPaths = scannedPaths;
            return this;
        }

        public Builder scanStartTime(Instant scanStartTime) {
            this.scanStartTime = scanStartTime;
            return this;
        }

        public Builder scanDuration(Duration scanDuration) {
            this.scanDuration = scanDuration;
            return this;
        }

        public Builder classesScanned(int classesScanned) {
            this.classesScanned = classesScanned;
            return this;
        }

        public Builder jarsScanned(int jarsScanned) {
            this.jarsScanned = jarsScanned;
            return this;
        }

        public Builder methodsAnalyzed(int methodsAnalyzed) {
            this.methodsAnalyzed = methodsAnalyzed;
            return this;
        }

        public Builder methodsSkipped(int methodsSkipped) {
            this.methodsSkipped = methodsSkipped;
            return this;
        }

        public Builder findings(List<Finding> findings) {
            this.findings = findings;
            return this;
        }

        public ScanReport build() {
            return new ScanReport(
                    scannedPaths,
                    scanStartTime,
                    scanDuration,
                    classesScanned,
                    jarsScanned,
                    methodsAnalyzed,
                    methodsSkipped,
                    findings
            );
        }
    }
}

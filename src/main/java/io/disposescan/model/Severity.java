package io.disposescan.model;

/**
 * How serious a finding is.
 */
public enum Severity {
    /**
     * Will almost certainly cause failures (crashes, corrupted data).
     */
    CRITICAL(1, "CRITICAL"),

    /**
     * Likely to cause failures in common use.
     */
    HIGH(2, "HIGH"),

    /**
     * May cause failures depending on how the type is used.
     * Use of a closed object without a clear error falls here.
     */
    MEDIUM(3, "MEDIUM"),

    /**
     * Unlikely to cause failures but worth fixing.
     */
    LOW(4, "LOW"),

    /**
     * Needs a human to look at it.
     */
    AUDIT(5, "AUDIT");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as serious as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a severity name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Unknown severity: null");
        }
        return switch (value.trim().toLowerCase()) {
            case "critical" -> CRITICAL;
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            case "low" -> LOW;
            case "audit" -> AUDIT;
            default -> throw new IllegalArgumentException("Unknown severity: " + value);
        };
    }
}

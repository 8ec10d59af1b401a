package io.disposescan.model;

/**
 * How sure a rule is that a finding is a real defect.
 */
public enum Confidence {
    TOTAL,
    HIGH,
    NORMAL,
    LOW
}

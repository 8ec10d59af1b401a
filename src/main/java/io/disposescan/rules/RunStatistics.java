package io.disposescan.rules;

/**
 * Counters of a rule run.
 *
 * @param methodsAnalyzed Methods handed to the rules
 * @param methodsFlagged  Rule checks that reported
 * @param methodsSkipped  Rule checks that could not interpret the body or failed unexpectedly
 */
public record RunStatistics(
        int methodsAnalyzed,
        int methodsFlagged,
        int methodsSkipped
) {
}

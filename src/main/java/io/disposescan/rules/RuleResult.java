package io.disposescan.rules;

/**
 * Outcome of running one rule on one method.
 */
public enum RuleResult {
    /** The rule has nothing to say about this kind of method */
    DOES_NOT_APPLY,
    /** The method was checked and is fine */
    SUCCESS,
    /** The method was checked and reported */
    FAILURE,
    /** The method body could not be interpreted and was skipped */
    MALFORMED
}

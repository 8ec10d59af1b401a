package io.disposescan.rules;

import io.disposescan.model.MethodInfo;

/**
 * A check applied to one method at a time.
 * <p>
 * Implementations must not keep per-method state in fields: the runner may call
 * {@link #checkMethod} for different methods concurrently.
 */
public interface MethodRule {

    /**
     * Returns a unique identifier for this rule.
     */
    String id();

    /**
     * Returns a one-line description of the defect the rule finds.
     */
    String problem();

    /**
     * Returns a one-line description of the fix.
     */
    String solution();

    /**
     * Checks a method and reports at most one finding for it to the sink.
     *
     * @param method  The method to check
     * @param context Shared, read-only collaborators and configuration
     * @param sink    Where findings go
     * @return What the rule concluded
     */
    RuleResult checkMethod(MethodInfo method, AnalysisContext context, FindingSink sink);

    /**
     * Returns true if this rule is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }
}

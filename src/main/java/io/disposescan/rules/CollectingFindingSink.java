package io.disposescan.rules;

import io.disposescan.model.Confidence;
import io.disposescan.model.Finding;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe sink that turns reports of one rule into {@link Finding}s.
 * Each report becomes one complete finding before it is queued.
 */
public class CollectingFindingSink implements FindingSink {

    /** Class, then method name, then descriptor */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::className)
            .thenComparing(Finding::methodName)
            .thenComparing(Finding::descriptor)
            .thenComparing(f -> f.ruleId() != null ? f.ruleId() : "");

    private final MethodRule rule;
    private final ConcurrentLinkedQueue<Finding> findings = new ConcurrentLinkedQueue<>();

    public CollectingFindingSink(MethodRule rule) {
        this.rule = rule;
    }

    @Override
    public void report(MethodInfo method, Severity severity, Confidence confidence) {
        Finding finding = Finding.forMethod(method)
                .severity(severity)
                .confidence(confidence)
                .ruleId(rule.id())
                .description(rule.problem())
                .recommendation(rule.solution())
                .build();
        findings.add(finding);
    }

    /**
     * Returns the findings collected so far, in report order.
     */
    public List<Finding> findings() {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(REPORT_ORDER);
        return sorted;
    }
}

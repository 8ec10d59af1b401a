package io.disposescan.rules;

import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.ClassInfo;
import io.disposescan.model.Finding;
import io.disposescan.model.MethodInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Runs method rules over every method of the scanned classes.
 * <p>
 * Methods are independent of each other, so they may be checked in parallel. A rule that
 * fails on one method costs that method only: the failure is logged and counted and the run
 * goes on.
 */
public class RuleRunner {

    private static final Logger log = LoggerFactory.getLogger(RuleRunner.class);

    private final List<MethodRule> rules;
    private final boolean parallel;

    private RunStatistics statistics = new RunStatistics(0, 0, 0);

    public RuleRunner(List<MethodRule> rules, boolean parallel) {
        this.rules = List.copyOf(rules);
        this.parallel = parallel;
    }

    /**
     * Checks all methods of all scanned classes in the pool.
     *
     * @return Findings of all rules, sorted by class, method and descriptor
     */
    public List<Finding> run(ClassPool pool, AnalysisContext context) {
        List<MethodInfo> methods = pool.scannedClasses().stream()
                .map(ClassInfo::methods)
                .flatMap(m -> m.values().stream())
                .toList();
        return run(methods, context);
    }

    /**
     * Checks the given methods.
     *
     * @return Findings of all rules, sorted by class, method and descriptor
     */
    public List<Finding> run(List<MethodInfo> methods, AnalysisContext context) {
        List<CollectingFindingSink> sinks = new ArrayList<>();
        AtomicInteger flagged = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();

        for (MethodRule rule : rules) {
            CollectingFindingSink sink = new CollectingFindingSink(rule);
            sinks.add(sink);

            Stream<MethodInfo> stream = parallel ? methods.parallelStream() : methods.stream();
            stream.forEach(method -> {
                RuleResult result = check(rule, method, context, sink);
                if (result == RuleResult.FAILURE) {
                    flagged.incrementAndGet();
                } else if (result == RuleResult.MALFORMED) {
                    skipped.incrementAndGet();
                }
            });
        }

        statistics = new RunStatistics(methods.size(), flagged.get(), skipped.get());

        List<Finding> findings = new ArrayList<>();
        for (CollectingFindingSink sink : sinks) {
            findings.addAll(sink.findings());
        }
        findings.sort(CollectingFindingSink.REPORT_ORDER);
        return findings;
    }

    private static RuleResult check(MethodRule rule, MethodInfo method, AnalysisContext context, FindingSink sink) {
        try {
            return rule.checkMethod(method, context, sink);
        } catch (RuntimeException e) {
            log.warn("Rule {} failed on {}", rule.id(), method, e);
            return RuleResult.MALFORMED;
        }
    }

    /**
     * Returns the counters of the last run.
     */
    public RunStatistics statistics() {
        return statistics;
    }
}

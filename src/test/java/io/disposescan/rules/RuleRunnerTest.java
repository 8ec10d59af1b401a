package io.disposescan.rules;

import io.disposescan.Fixtures;
import io.disposescan.config.RuleConfig;
import io.disposescan.fixtures.ExemptMethods;
import io.disposescan.fixtures.GuardedWriter;
import io.disposescan.fixtures.WriteStuff;
import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.Confidence;
import io.disposescan.model.Finding;
import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleRunnerTest {

    @Test
    void run_parallelMatchesSequential() {
        ClassPool pool = Fixtures.pool(WriteStuff.class, GuardedWriter.class, ExemptMethods.class);
        AnalysisContext context = AnalysisContext.of(pool, RuleConfig.loadDefault());

        List<Finding> sequential = new RuleRunner(RuleRegistry.createDefault().enabledRules(), false).run(pool, context);
        List<Finding> parallel = new RuleRunner(RuleRegistry.createDefault().enabledRules(), true).run(pool, context);

        assertThat(parallel).isEqualTo(sequential);
        assertThat(sequential)
                .extracting(f -> f.simpleClassName() + "." + f.methodName())
                .containsExactly("GuardedWriter.append", "WriteStuff.flush", "WriteStuff.write");
    }

    @Test
    void run_countsAnalyzedAndFlaggedMethods() {
        ClassPool pool = Fixtures.pool(WriteStuff.class);
        AnalysisContext context = AnalysisContext.of(pool, RuleConfig.loadDefault());
        RuleRunner runner = new RuleRunner(RuleRegistry.createDefault().enabledRules(), true);

        runner.run(pool, context);

        RunStatistics statistics = runner.statistics();
        assertThat(statistics.methodsAnalyzed()).isEqualTo(pool.scannedClasses().iterator().next().methods().size());
        assertThat(statistics.methodsFlagged()).isEqualTo(2);
        assertThat(statistics.methodsSkipped()).isZero();
    }

    @Test
    void run_isolatesRuleFailures() {
        MethodRule exploding = new StubRule() {
            @Override
            public RuleResult checkMethod(MethodInfo method, AnalysisContext context, FindingSink sink) {
                if (method.name().equals("boom")) {
                    throw new IllegalStateException("boom");
                }
                sink.report(method, Severity.LOW, Confidence.NORMAL);
                return RuleResult.FAILURE;
            }
        };
        List<MethodInfo> methods = new ArrayList<>();
        for (String name : List.of("zeta", "boom", "alpha")) {
            methods.add(MethodInfo.builder().declaringType("com.example.Resource").name(name)
                    .flag(MethodFlag.PUBLIC).build());
        }
        ClassPool pool = ClassPool.builder().libraryLoader(null).build();

        RuleRunner runner = new RuleRunner(List.of(exploding), true);
        List<Finding> findings = runner.run(methods, AnalysisContext.of(pool, RuleConfig.loadDefault()));

        assertThat(findings).extracting(Finding::methodName).containsExactly("alpha", "zeta");
        assertThat(runner.statistics().methodsSkipped()).isEqualTo(1);
        assertThat(runner.statistics().methodsFlagged()).isEqualTo(2);
    }

    private abstract static class StubRule implements MethodRule {
        @Override
        public String id() {
            return "stub";
        }

        @Override
        public String problem() {
            return "Stub problem";
        }

        @Override
        public String solution() {
            return "Stub solution";
        }
    }
}

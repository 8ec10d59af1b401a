package io.disposescan.rules;

import io.disposescan.config.RuleConfig;
import io.disposescan.hierarchy.ClassPool;
import io.disposescan.hierarchy.ReferenceResolver;
import io.disposescan.hierarchy.TypeHierarchy;

/**
 * Read-only collaborators shared by all method checks of a run.
 *
 * @param hierarchy     Subtype queries
 * @param resolver      Method reference resolution
 * @param generatedCode Generated code detection
 * @param config        Rule configuration
 */
public record AnalysisContext(
        TypeHierarchy hierarchy,
        ReferenceResolver resolver,
        GeneratedCodeMarker generatedCode,
        RuleConfig config
) {
    public AnalysisContext {
        if (hierarchy == null || resolver == null) {
            throw new IllegalArgumentException("hierarchy and resolver are required");
        }
        if (generatedCode == null) {
            generatedCode = GeneratedCodeMarker.FROM_FLAGS;
        }
        if (config == null) {
            config = RuleConfig.loadDefault();
        }
        config.requireComplete();
    }

    /**
     * Creates a context backed by a class pool.
     */
    public static AnalysisContext of(ClassPool pool, RuleConfig config) {
        return new AnalysisContext(pool, pool, GeneratedCodeMarker.FROM_FLAGS, config);
    }
}

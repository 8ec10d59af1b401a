package io.disposescan.rules;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of all available rules.
 */
public class RuleRegistry {

    private final List<MethodRule> rules;

    private RuleRegistry(List<MethodRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a registry with all default rules.
     */
    public static RuleRegistry createDefault() {
        return new RuleRegistry(List.of(
                new UseDisposedGuardExceptionRule()
        ));
    }

    /**
     * Creates a registry with specific rules.
     */
    public static RuleRegistry of(MethodRule... rules) {
        return new RuleRegistry(Arrays.asList(rules));
    }

    /**
     * Returns the rules enabled by default.
     */
    public List<MethodRule> enabledRules() {
        return rules.stream()
                .filter(MethodRule::enabledByDefault)
                .toList();
    }

    /**
     * Returns the rules with the given IDs, in registration order.
     */
    public List<MethodRule> rules(Set<String> ruleIds) {
        return rules.stream()
                .filter(r -> ruleIds.contains(r.id()))
                .toList();
    }

    /**
     * Returns a rule by ID, if present.
     */
    public Optional<MethodRule> getById(String id) {
        return rules.stream()
                .filter(r -> r.id().equals(id))
                .findFirst();
    }
}

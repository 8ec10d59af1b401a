package io.disposescan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Information about a scanned class.
 *
 * @param fqn                   Fully qualified class name (e.g., "com.example.MyClass")
 * @param superClass            FQN of the superclass (null for java.lang.Object and interfaces without one)
 * @param implementedInterfaces Interface FQNs directly implemented (or extended) by this class
 * @param isInterface           Whether this is an interface
 * @param isGenerated           Whether the class is synthetic or annotated as generated
 * @param sourceFile            Source file name from debug info, may be null
 * @param methods               Map of method key (name+descriptor) to MethodInfo, in declaration order
 */
public record ClassInfo(
        String fqn,
        String superClass,
        Set<String> implementedInterfaces,
        boolean isInterface,
        boolean isGenerated,
        String sourceFile,
        Map<String, MethodInfo> methods
) {
    public ClassInfo {
        if (fqn == null || fqn.isBlank()) {
            throw new IllegalArgumentException("fqn cannot be null or blank");
        }
        implementedInterfaces = implementedInterfaces != null ? Set.copyOf(implementedInterfaces) : Set.of();
        methods = methods != null ? Collections.unmodifiableMap(new LinkedHashMap<>(methods)) : Map.of();
    }

    /**
     * Returns the simple class name (e.g., "MyClass" from "com.example.MyClass").
     */
    public String simpleName() {
        int lastDot = fqn.lastIndexOf('.');
        return lastDot >= 0 ? fqn.substring(lastDot + 1) : fqn;
    }

    /**
     * Finds a method by name and descriptor.
     */
    public Optional<MethodInfo> findMethod(String name, String descriptor) {
        return Optional.ofNullable(methods.get(name + descriptor));
    }

    /**
     * Find a method by name (returns first match if overloaded).
     */
    public Optional<MethodInfo> findMethodByName(String name) {
        return methods.values().stream()
                .filter(m -> m.name().equals(name))
                .findFirst();
    }
}

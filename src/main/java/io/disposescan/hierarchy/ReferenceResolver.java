package io.disposescan.hierarchy;

import io.disposescan.model.MethodInfo;
import io.disposescan.model.MethodRef;

import java.util.Optional;

/**
 * Finds the method definition a symbolic reference points at.
 */
public interface ReferenceResolver {

    /**
     * Resolves a method reference the way the JVM does: the named class first, then its super
     * classes, then its super interfaces.
     *
     * @return the definition, or empty when it cannot be found
     */
    Optional<MethodInfo> resolve(MethodRef ref);
}

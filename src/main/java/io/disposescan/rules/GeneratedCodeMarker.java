package io.disposescan.rules;

import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;

/**
 * Tells compiler- or tool-generated methods apart from hand-written ones.
 */
@FunctionalInterface
public interface GeneratedCodeMarker {

    /**
     * Uses the flag the class scanner derives from synthetic and bridge access flags
     * and from {@code @Generated} annotations.
     */
    GeneratedCodeMarker FROM_FLAGS = method -> method.is(MethodFlag.GENERATED_CODE);

    boolean isGeneratedCode(MethodInfo method);
}

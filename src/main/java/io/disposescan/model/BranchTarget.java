package io.disposescan.model;

import java.util.List;

/**
 * Jump destinations of a branch or switch instruction, as instruction offsets.
 */
public record BranchTarget(List<Integer> offsets) implements Operand {

    public BranchTarget {
        offsets = offsets == null ? List.of() : List.copyOf(offsets);
    }

    public static BranchTarget of(Integer... offsets) {
        return new BranchTarget(List.of(offsets));
    }
}

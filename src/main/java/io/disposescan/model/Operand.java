package io.disposescan.model;

/**
 * Operand attached to a decoded instruction.
 * One of {@link #NONE}, {@link FieldRef}, {@link MethodRef}, {@link TypeRef} or {@link BranchTarget}.
 */
public interface Operand {

    /**
     * Marker for instructions without an operand the analysis cares about.
     */
    Operand NONE = new Operand() {
        @Override
        public String toString() {
            return "none";
        }
    };
}

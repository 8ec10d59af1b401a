package io.disposescan.model;

/**
 * Symbolic reference to a field, as it appears in a field instruction.
 *
 * @param declaringType FQN of the class named by the instruction
 * @param name          Field name
 * @param descriptor    JVM field descriptor
 */
public record FieldRef(
        String declaringType,
        String name,
        String descriptor
) implements Operand {

    @Override
    public String toString() {
        return declaringType + "." + name + ":" + descriptor;
    }
}

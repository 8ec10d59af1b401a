package io.disposescan.model;

import io.disposescan.bytecode.DescriptorParser;

import java.util.List;

/**
 * Symbolic reference to a method, as it appears in an invoke instruction.
 *
 * @param declaringType FQN of the class named by the instruction
 * @param name          Method name
 * @param descriptor    JVM method descriptor
 */
public record MethodRef(
        String declaringType,
        String name,
        String descriptor
) implements Operand {

    /**
     * Returns a unique key for this method within its class (name + descriptor).
     */
    public String key() {
        return name + descriptor;
    }

    public String returnType() {
        return DescriptorParser.parseReturnType(descriptor);
    }

    public List<String> parameterTypes() {
        return DescriptorParser.parseParameterTypes(descriptor);
    }

    @Override
    public String toString() {
        return declaringType + "." + name + descriptor;
    }
}

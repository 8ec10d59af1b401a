package io.disposescan.model;

/**
 * Reference to a class, e.g. the type allocated by a {@code new} instruction.
 *
 * @param fqn Fully qualified class name
 */
public record TypeRef(String fqn) implements Operand {

    @Override
    public String toString() {
        return fqn;
    }
}

package io.disposescan.model;

import java.util.List;

/**
 * Set of {@link OpCode} categories packed into a single {@code long}.
 * <p>
 * A method's bitmask is the union of the categories of all its instructions. It is computed
 * once and answers "could this method contain anything of interest?" in constant time.
 */
public final class OpCodeBitmask {

    public static final OpCodeBitmask EMPTY = new OpCodeBitmask(0L);

    /** Calls and instance field accesses */
    public static final OpCodeBitmask CALLS_AND_FIELDS = of(
            OpCode.INVOKE_DIRECT,
            OpCode.INVOKE_VIRTUAL,
            OpCode.LOAD_FIELD,
            OpCode.STORE_FIELD,
            OpCode.LOAD_FIELD_ADDRESS);

    private final long bits;

    private OpCodeBitmask(long bits) {
        this.bits = bits;
    }

    public static OpCodeBitmask of(OpCode... codes) {
        long bits = 0L;
        for (OpCode code : codes) {
            bits |= bit(code);
        }
        return new OpCodeBitmask(bits);
    }

    /**
     * Computes the union of the categories present in an instruction sequence.
     */
    public static OpCodeBitmask summarize(List<Instruction> instructions) {
        long bits = 0L;
        for (Instruction ins : instructions) {
            bits |= bit(ins.opCode());
        }
        return new OpCodeBitmask(bits);
    }

    /**
     * Returns the bitmask of a method. Computed once when the method model is built.
     */
    public static OpCodeBitmask summarize(MethodInfo method) {
        return method.opCodeBitmask();
    }

    private static long bit(OpCode code) {
        return 1L << code.ordinal();
    }

    public boolean get(OpCode code) {
        return (bits & bit(code)) != 0;
    }

    /**
     * Returns true if at least one category is present in both masks.
     */
    public boolean intersects(OpCodeBitmask other) {
        return (bits & other.bits) != 0;
    }

    public boolean isEmpty() {
        return bits == 0L;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OpCodeBitmask other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(bits);
    }
}

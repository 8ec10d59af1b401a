package io.disposescan.model;

/**
 * A single decoded instruction of a method body.
 *
 * @param offset    Position within the method; strictly increasing along the body
 * @param opCode    Category of the instruction
 * @param mnemonic  JVM opcode name (for diagnostics only)
 * @param operand   Field, method, type or branch operand, or {@link Operand#NONE}
 * @param stackPop  Operand-stack words consumed
 * @param stackPush Operand-stack words produced
 * @param flow      How control leaves the instruction
 */
public record Instruction(
        int offset,
        OpCode opCode,
        String mnemonic,
        Operand operand,
        int stackPop,
        int stackPush,
        FlowControl flow
) {
    public Instruction {
        if (opCode == null) {
            throw new IllegalArgumentException("opCode cannot be null");
        }
        if (operand == null) {
            operand = Operand.NONE;
        }
        if (flow == null) {
            flow = FlowControl.NEXT;
        }
        if (mnemonic == null) {
            mnemonic = opCode.name().toLowerCase();
        }
    }

    /**
     * Returns true if this instruction duplicates the top word of the stack (dup).
     */
    public boolean isDup() {
        return "dup".equals(mnemonic) && stackPop == 1 && stackPush == 2;
    }

    public MethodRef methodRef() {
        return operand instanceof MethodRef ref ? ref : null;
    }

    public FieldRef fieldRef() {
        return operand instanceof FieldRef ref ? ref : null;
    }

    public TypeRef typeRef() {
        return operand instanceof TypeRef ref ? ref : null;
    }

    @Override
    public String toString() {
        String hex = String.format("%04X", offset);
        return operand == Operand.NONE ? hex + ": " + mnemonic : hex + ": " + mnemonic + " " + operand;
    }
}

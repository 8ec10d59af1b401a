package io.disposescan.bytecode;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Operand-stack effect of a JVM instruction, in words (long and double take two).
 *
 * @param pop  Words consumed
 * @param push Words produced
 */
public record StackEffect(int pop, int push) {

    public static final StackEffect NONE = new StackEffect(0, 0);

    /**
     * Effect of an instruction without operands (visitInsn).
     */
    public static StackEffect forInsn(int opcode) {
        return switch (opcode) {
            case Opcodes.NOP -> NONE;
            case Opcodes.ACONST_NULL,
                 Opcodes.ICONST_M1, Opcodes.ICONST_0, Opcodes.ICONST_1, Opcodes.ICONST_2,
                 Opcodes.ICONST_3, Opcodes.ICONST_4, Opcodes.ICONST_5,
                 Opcodes.FCONST_0, Opcodes.FCONST_1, Opcodes.FCONST_2 -> new StackEffect(0, 1);
            case Opcodes.LCONST_0, Opcodes.LCONST_1, Opcodes.DCONST_0, Opcodes.DCONST_1 -> new StackEffect(0, 2);
            case Opcodes.IALOAD, Opcodes.FALOAD, Opcodes.AALOAD,
                 Opcodes.BALOAD, Opcodes.CALOAD, Opcodes.SALOAD -> new StackEffect(2, 1);
            case Opcodes.LALOAD, Opcodes.DALOAD -> new StackEffect(2, 2);
            case Opcodes.IASTORE, Opcodes.FASTORE, Opcodes.AASTORE,
                 Opcodes.BASTORE, Opcodes.CASTORE, Opcodes.SASTORE -> new StackEffect(3, 0);
            case Opcodes.LASTORE, Opcodes.DASTORE -> new StackEffect(4, 0);
            case Opcodes.POP -> new StackEffect(1, 0);
            case Opcodes.POP2 -> new StackEffect(2, 0);
            case Opcodes.DUP -> new StackEffect(1, 2);
            case Opcodes.DUP_X1 -> new StackEffect(2, 3);
            case Opcodes.DUP_X2 -> new StackEffect(3, 4);
            case Opcodes.DUP2 -> new StackEffect(2, 4);
            case Opcodes.DUP2_X1 -> new StackEffect(3, 5);
            case Opcodes.DUP2_X2 -> new StackEffect(4, 6);
            case Opcodes.SWAP -> new StackEffect(2, 2);
            case Opcodes.IADD, Opcodes.FADD, Opcodes.ISUB, Opcodes.FSUB,
                 Opcodes.IMUL, Opcodes.FMUL, Opcodes.IDIV, Opcodes.FDIV,
                 Opcodes.IREM, Opcodes.FREM, Opcodes.ISHL, Opcodes.ISHR, Opcodes.IUSHR,
                 Opcodes.IAND, Opcodes.IOR, Opcodes.IXOR -> new StackEffect(2, 1);
            case Opcodes.LADD, Opcodes.DADD, Opcodes.LSUB, Opcodes.DSUB,
                 Opcodes.LMUL, Opcodes.DMUL, Opcodes.LDIV, Opcodes.DDIV,
                 Opcodes.LREM, Opcodes.DREM, Opcodes.LAND, Opcodes.LOR, Opcodes.LXOR -> new StackEffect(4, 2);
            case Opcodes.LSHL, Opcodes.LSHR, Opcodes.LUSHR -> new StackEffect(3, 2);
            case Opcodes.INEG, Opcodes.FNEG -> new StackEffect(1, 1);
            case Opcodes.LNEG, Opcodes.DNEG -> new StackEffect(2, 2);
            case Opcodes.I2F, Opcodes.F2I, Opcodes.I2B, Opcodes.I2C, Opcodes.I2S -> new StackEffect(1, 1);
            case Opcodes.I2L, Opcodes.I2D, Opcodes.F2L, Opcodes.F2D -> new StackEffect(1, 2);
            case Opcodes.L2I, Opcodes.L2F, Opcodes.D2I, Opcodes.D2F -> new StackEffect(2, 1);
            case Opcodes.L2D, Opcodes.D2L -> new StackEffect(2, 2);
            case Opcodes.LCMP, Opcodes.DCMPL, Opcodes.DCMPG -> new StackEffect(4, 1);
            case Opcodes.FCMPL, Opcodes.FCMPG -> new StackEffect(2, 1);
            case Opcodes.IRETURN, Opcodes.FRETURN, Opcodes.ARETURN -> new StackEffect(1, 0);
            case Opcodes.LRETURN, Opcodes.DRETURN -> new StackEffect(2, 0);
            case Opcodes.RETURN -> NONE;
            case Opcodes.ARRAYLENGTH -> new StackEffect(1, 1);
            case Opcodes.ATHROW -> new StackEffect(1, 0);
            case Opcodes.MONITORENTER, Opcodes.MONITOREXIT -> new StackEffect(1, 0);
            default -> throw new IllegalArgumentException("Not a zero-operand opcode: " + opcode);
        };
    }

    /**
     * Effect of a local variable instruction (visitVarInsn).
     */
    public static StackEffect forVarInsn(int opcode) {
        return switch (opcode) {
            case Opcodes.ILOAD, Opcodes.FLOAD, Opcodes.ALOAD -> new StackEffect(0, 1);
            case Opcodes.LLOAD, Opcodes.DLOAD -> new StackEffect(0, 2);
            case Opcodes.ISTORE, Opcodes.FSTORE, Opcodes.ASTORE -> new StackEffect(1, 0);
            case Opcodes.LSTORE, Opcodes.DSTORE -> new StackEffect(2, 0);
            case Opcodes.RET -> NONE;
            default -> throw new IllegalArgumentException("Not a variable opcode: " + opcode);
        };
    }

    /**
     * Effect of a jump instruction (visitJumpInsn).
     */
    public static StackEffect forJumpInsn(int opcode) {
        return switch (opcode) {
            case Opcodes.IFEQ, Opcodes.IFNE, Opcodes.IFLT, Opcodes.IFGE, Opcodes.IFGT, Opcodes.IFLE,
                 Opcodes.IFNULL, Opcodes.IFNONNULL -> new StackEffect(1, 0);
            case Opcodes.IF_ICMPEQ, Opcodes.IF_ICMPNE, Opcodes.IF_ICMPLT, Opcodes.IF_ICMPGE,
                 Opcodes.IF_ICMPGT, Opcodes.IF_ICMPLE, Opcodes.IF_ACMPEQ, Opcodes.IF_ACMPNE -> new StackEffect(2, 0);
            case Opcodes.GOTO -> NONE;
            case Opcodes.JSR -> new StackEffect(0, 1);
            default -> throw new IllegalArgumentException("Not a jump opcode: " + opcode);
        };
    }

    /**
     * Effect of a field instruction (visitFieldInsn).
     */
    public static StackEffect forFieldInsn(int opcode, String descriptor) {
        int size = Type.getType(descriptor).getSize();
        return switch (opcode) {
            case Opcodes.GETSTATIC -> new StackEffect(0, size);
            case Opcodes.PUTSTATIC -> new StackEffect(size, 0);
            case Opcodes.GETFIELD -> new StackEffect(1, size);
            case Opcodes.PUTFIELD -> new StackEffect(1 + size, 0);
            default -> throw new IllegalArgumentException("Not a field opcode: " + opcode);
        };
    }

    /**
     * Effect of a method call (visitMethodInsn). The receiver counts as one popped word
     * for every opcode but invokestatic.
     */
    public static StackEffect forMethodInsn(int opcode, String descriptor) {
        int sizes = Type.getArgumentsAndReturnSizes(descriptor);
        int argumentWords = (sizes >> 2) - 1;
        int returnWords = sizes & 0x3;
        int receiver = opcode == Opcodes.INVOKESTATIC ? 0 : 1;
        return new StackEffect(argumentWords + receiver, returnWords);
    }

    /**
     * Effect of an invokedynamic call site.
     */
    public static StackEffect forInvokeDynamic(String descriptor) {
        int sizes = Type.getArgumentsAndReturnSizes(descriptor);
        return new StackEffect((sizes >> 2) - 1, sizes & 0x3);
    }

    /**
     * Effect of an ldc with the given constant.
     */
    public static StackEffect forLdc(Object value) {
        return value instanceof Long || value instanceof Double ? new StackEffect(0, 2) : new StackEffect(0, 1);
    }
}

package io.disposescan.bytecode;

import io.disposescan.model.BranchTarget;
import io.disposescan.model.FieldRef;
import io.disposescan.model.FlowControl;
import io.disposescan.model.Instruction;
import io.disposescan.model.MethodRef;
import io.disposescan.model.OpCode;
import io.disposescan.model.Operand;
import io.disposescan.model.TypeRef;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.util.Printer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MethodVisitor that decodes a method body into {@link Instruction}s.
 * <p>
 * Offsets are the positions of real instructions in visiting order (labels, line numbers
 * and frames are not instructions). Jump targets and exception handler entries are resolved
 * from ASM labels to offsets once the whole body has been visited.
 * <p>
 * {@code aload_0} decodes to {@link OpCode#LOAD_SELF} only in instance methods that never
 * store into slot 0; otherwise the slot may hold something other than the receiver.
 */
public class InstructionDecoder extends MethodVisitor {

    private final boolean isStaticMethod;

    private final List<PendingInsn> pending = new ArrayList<>();
    private final Map<Label, Integer> labelOffsets = new HashMap<>();
    private final List<Label> handlerLabels = new ArrayList<>();
    private boolean slotZeroReassigned = false;
    private int firstLine = -1;

    private List<Instruction> instructions = List.of();
    private List<Integer> handlerOffsets = List.of();

    private static final class PendingInsn {
        final OpCode opCode;
        final String mnemonic;
        final Operand operand;
        final List<Label> targets;
        final StackEffect effect;
        final FlowControl flow;

        PendingInsn(OpCode opCode, String mnemonic, Operand operand, List<Label> targets,
                    StackEffect effect, FlowControl flow) {
            this.opCode = opCode;
            this.mnemonic = mnemonic;
            this.operand = operand;
            this.targets = targets;
            this.effect = effect;
            this.flow = flow;
        }
    }

    public InstructionDecoder(boolean isStaticMethod) {
        super(Opcodes.ASM9);
        this.isStaticMethod = isStaticMethod;
    }

    private void add(int opcode, OpCode category, Operand operand, StackEffect effect, FlowControl flow) {
        pending.add(new PendingInsn(category, mnemonic(opcode), operand, null, effect, flow));
    }

    private static String mnemonic(int opcode) {
        return Printer.OPCODES[opcode].toLowerCase(Locale.ROOT);
    }

    @Override
    public void visitInsn(int opcode) {
        FlowControl flow = switch (opcode) {
            case Opcodes.IRETURN, Opcodes.LRETURN, Opcodes.FRETURN, Opcodes.DRETURN,
                 Opcodes.ARETURN, Opcodes.RETURN -> FlowControl.RETURN;
            case Opcodes.ATHROW -> FlowControl.THROW;
            default -> FlowControl.NEXT;
        };
        add(opcode, OpCode.OTHER, Operand.NONE, StackEffect.forInsn(opcode), flow);
    }

    @Override
    public void visitIntInsn(int opcode, int operand) {
        // bipush, sipush push one word; newarray swaps the count for the array
        StackEffect effect = opcode == Opcodes.NEWARRAY ? new StackEffect(1, 1) : new StackEffect(0, 1);
        add(opcode, OpCode.OTHER, Operand.NONE, effect, FlowControl.NEXT);
    }

    @Override
    public void visitVarInsn(int opcode, int varIndex) {
        OpCode category = OpCode.OTHER;
        if (opcode == Opcodes.ALOAD && varIndex == 0 && !isStaticMethod) {
            category = OpCode.LOAD_SELF;
        } else if (varIndex == 0 && opcode >= Opcodes.ISTORE && opcode <= Opcodes.ASTORE) {
            slotZeroReassigned = true;
        }
        FlowControl flow = opcode == Opcodes.RET ? FlowControl.RETURN : FlowControl.NEXT;
        add(opcode, category, Operand.NONE, StackEffect.forVarInsn(opcode), flow);
    }

    @Override
    public void visitTypeInsn(int opcode, String type) {
        if (opcode == Opcodes.NEW) {
            add(opcode, OpCode.CONSTRUCT_OBJECT, new TypeRef(DescriptorParser.toFqn(type)),
                    new StackEffect(0, 1), FlowControl.NEXT);
        } else {
            // anewarray, checkcast, instanceof: one reference in, one word out
            add(opcode, OpCode.OTHER, new TypeRef(DescriptorParser.toFqn(type)),
                    new StackEffect(1, 1), FlowControl.NEXT);
        }
    }

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
        OpCode category = switch (opcode) {
            case Opcodes.GETFIELD -> OpCode.LOAD_FIELD;
            case Opcodes.PUTFIELD -> OpCode.STORE_FIELD;
            default -> OpCode.OTHER;
        };
        FieldRef field = new FieldRef(DescriptorParser.toFqn(owner), name, descriptor);
        add(opcode, category, field, StackEffect.forFieldInsn(opcode, descriptor), FlowControl.NEXT);
    }

    @Override
    public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
        OpCode category = switch (opcode) {
            case Opcodes.INVOKEVIRTUAL, Opcodes.INVOKEINTERFACE -> OpCode.INVOKE_VIRTUAL;
            default -> OpCode.INVOKE_DIRECT;
        };
        MethodRef method = new MethodRef(DescriptorParser.toFqn(owner), name, descriptor);
        add(opcode, category, method, StackEffect.forMethodInsn(opcode, descriptor), FlowControl.NEXT);
    }

    @Override
    public void visitInvokeDynamicInsn(String name, String descriptor, Handle bootstrapMethodHandle,
                                       Object... bootstrapMethodArguments) {
        add(Opcodes.INVOKEDYNAMIC, OpCode.OTHER, Operand.NONE,
                StackEffect.forInvokeDynamic(descriptor), FlowControl.NEXT);
    }

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        FlowControl flow = opcode == Opcodes.GOTO || opcode == Opcodes.JSR
                ? FlowControl.BRANCH
                : FlowControl.CONDITIONAL_BRANCH;
        pending.add(new PendingInsn(OpCode.OTHER, mnemonic(opcode), null, List.of(label),
                StackEffect.forJumpInsn(opcode), flow));
    }

    @Override
    public void visitLabel(Label label) {
        labelOffsets.put(label, pending.size());
    }

    @Override
    public void visitLdcInsn(Object value) {
        add(Opcodes.LDC, OpCode.OTHER, Operand.NONE, StackEffect.forLdc(value), FlowControl.NEXT);
    }

    @Override
    public void visitIincInsn(int varIndex, int increment) {
        add(Opcodes.IINC, OpCode.OTHER, Operand.NONE, StackEffect.NONE, FlowControl.NEXT);
    }

    @Override
    public void visitTableSwitchInsn(int min, int max, Label dflt, Label... labels) {
        addSwitch(Opcodes.TABLESWITCH, dflt, labels);
    }

    @Override
    public void visitLookupSwitchInsn(Label dflt, int[] keys, Label[] labels) {
        addSwitch(Opcodes.LOOKUPSWITCH, dflt, labels);
    }

    private void addSwitch(int opcode, Label dflt, Label[] labels) {
        List<Label> targets = new ArrayList<>(labels.length + 1);
        targets.add(dflt);
        targets.addAll(List.of(labels));
        pending.add(new PendingInsn(OpCode.OTHER, mnemonic(opcode), null, targets,
                new StackEffect(1, 0), FlowControl.SWITCH));
    }

    @Override
    public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
        add(Opcodes.MULTIANEWARRAY, OpCode.OTHER, new TypeRef(DescriptorParser.parseFieldType(descriptor)),
                new StackEffect(numDimensions, 1), FlowControl.NEXT);
    }

    @Override
    public void visitTryCatchBlock(Label start, Label end, Label handler, String type) {
        handlerLabels.add(handler);
    }

    @Override
    public void visitLineNumber(int line, Label start) {
        if (firstLine < 0 || line < firstLine) {
            firstLine = line;
        }
    }

    @Override
    public void visitEnd() {
        List<Instruction> decoded = new ArrayList<>(pending.size());
        for (int offset = 0; offset < pending.size(); offset++) {
            PendingInsn p = pending.get(offset);
            OpCode category = p.opCode == OpCode.LOAD_SELF && slotZeroReassigned ? OpCode.OTHER : p.opCode;
            Operand operand = p.operand;
            if (p.targets != null) {
                List<Integer> offsets = new ArrayList<>(p.targets.size());
                for (Label target : p.targets) {
                    offsets.add(resolve(target));
                }
                operand = new BranchTarget(offsets);
            }
            decoded.add(new Instruction(offset, category, p.mnemonic, operand,
                    p.effect.pop(), p.effect.push(), p.flow));
        }
        List<Integer> handlers = new ArrayList<>(handlerLabels.size());
        for (Label handler : handlerLabels) {
            int offset = resolve(handler);
            if (!handlers.contains(offset)) {
                handlers.add(offset);
            }
        }
        this.instructions = List.copyOf(decoded);
        this.handlerOffsets = List.copyOf(handlers);
        super.visitEnd();
    }

    // Labels never visited resolve to -1, which validation later rejects
    private int resolve(Label label) {
        Integer offset = labelOffsets.get(label);
        return offset != null ? offset : -1;
    }

    /**
     * Returns the decoded instructions. Valid after {@link #visitEnd()}.
     */
    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Returns exception handler entry offsets. Valid after {@link #visitEnd()}.
     */
    public List<Integer> getHandlerOffsets() {
        return handlerOffsets;
    }

    /**
     * Returns the lowest source line seen, or -1 without debug info.
     */
    public int getFirstLine() {
        return firstLine;
    }
}

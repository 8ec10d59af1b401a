package io.disposescan.model;

import io.disposescan.bytecode.DescriptorParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decoded method: identity, flags and instruction stream.
 * <p>
 * Instances are immutable and safe to share between threads. The opcode bitmask and the
 * offset index are computed once, at construction.
 */
public final class MethodInfo {

    private final String declaringType;
    private final String name;
    private final String descriptor;
    private final Set<MethodFlag> flags;
    private final List<Instruction> instructions;
    private final List<Integer> handlerOffsets;
    private final String sourceFile;
    private final int firstLine;

    private final OpCodeBitmask opCodeBitmask;
    private final Map<Integer, Integer> indexByOffset;
    private final Set<Integer> branchTargets;

    private MethodInfo(Builder builder) {
        if (builder.declaringType == null || builder.declaringType.isBlank()) {
            throw new IllegalArgumentException("declaringType cannot be null or blank");
        }
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.declaringType = builder.declaringType;
        this.name = builder.name;
        this.descriptor = builder.descriptor != null ? builder.descriptor : "()V";
        this.flags = builder.flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MethodFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.instructions = List.copyOf(builder.instructions);
        this.handlerOffsets = List.copyOf(builder.handlerOffsets);
        this.sourceFile = builder.sourceFile;
        this.firstLine = builder.firstLine;

        this.opCodeBitmask = OpCodeBitmask.summarize(instructions);

        Map<Integer, Integer> index = new HashMap<>();
        Set<Integer> targets = new LinkedHashSet<>(handlerOffsets);
        for (int i = 0; i < instructions.size(); i++) {
            Instruction ins = instructions.get(i);
            index.putIfAbsent(ins.offset(), i);
            if (ins.operand() instanceof BranchTarget target) {
                targets.addAll(target.offsets());
            }
        }
        this.indexByOffset = Map.copyOf(index);
        this.branchTargets = Collections.unmodifiableSet(targets);
    }

    public String declaringType() {
        return declaringType;
    }

    public String name() {
        return name;
    }

    public String descriptor() {
        return descriptor;
    }

    public Set<MethodFlag> flags() {
        return flags;
    }

    public boolean is(MethodFlag flag) {
        return flags.contains(flag);
    }

    public boolean isPublic() {
        return is(MethodFlag.PUBLIC);
    }

    public boolean isStatic() {
        return is(MethodFlag.STATIC);
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    /**
     * Offsets at which exception handlers begin.
     */
    public List<Integer> handlerOffsets() {
        return handlerOffsets;
    }

    public String sourceFile() {
        return sourceFile;
    }

    /**
     * First source line of the body, or -1 without debug info.
     */
    public int firstLine() {
        return firstLine;
    }

    public OpCodeBitmask opCodeBitmask() {
        return opCodeBitmask;
    }

    /**
     * Returns true if the method has instructions to analyze.
     */
    public boolean hasBody() {
        return !instructions.isEmpty() && !is(MethodFlag.ABSTRACT) && !is(MethodFlag.NATIVE);
    }

    /**
     * Returns the list index of the instruction at the given offset, or -1.
     */
    public int indexOf(int offset) {
        Integer index = indexByOffset.get(offset);
        return index != null ? index : -1;
    }

    /**
     * Offsets control can jump to: branch and switch destinations plus handler entries.
     */
    public Set<Integer> branchTargets() {
        return branchTargets;
    }

    public List<String> parameterTypes() {
        return DescriptorParser.parseParameterTypes(descriptor);
    }

    public int parameterCount() {
        return parameterTypes().size();
    }

    public String returnType() {
        return DescriptorParser.parseReturnType(descriptor);
    }

    /**
     * Unique key within the declaring class.
     */
    public String key() {
        return name + descriptor;
    }

    /**
     * Returns a human-readable signature, e.g. {@code com.example.Writer.write(java.lang.String)}.
     */
    public String signature() {
        return declaringType + "." + name + "(" + String.join(", ", parameterTypes()) + ")";
    }

    @Override
    public String toString() {
        return declaringType + "." + name + descriptor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String declaringType;
        private String name;
        private String descriptor;
        private final Set<MethodFlag> flags = EnumSet.noneOf(MethodFlag.class);
        private final List<Instruction> instructions = new ArrayList<>();
        private final List<Integer> handlerOffsets = new ArrayList<>();
        private String sourceFile;
        private int firstLine = -1;

        public Builder declaringType(String declaringType) {
            this.declaringType = declaringType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder descriptor(String descriptor) {
            this.descriptor = descriptor;
            return this;
        }

        public Builder flag(MethodFlag flag) {
            this.flags.add(flag);
            return this;
        }

        public Builder flags(Set<MethodFlag> flags) {
            this.flags.addAll(flags);
            return this;
        }

        public Builder instruction(Instruction instruction) {
            this.instructions.add(instruction);
            return this;
        }

        public Builder instructions(List<Instruction> instructions) {
            this.instructions.addAll(instructions);
            return this;
        }

        public Builder handlerOffset(int offset) {
            this.handlerOffsets.add(offset);
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder firstLine(int firstLine) {
            this.firstLine = firstLine;
            return this;
        }

        public MethodInfo build() {
            return new MethodInfo(this);
        }
    }
}

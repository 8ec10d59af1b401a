package io.disposescan.analysis;

import io.disposescan.model.BranchTarget;
import io.disposescan.model.Instruction;
import io.disposescan.model.MethodInfo;

import java.util.List;

/**
 * Checks the structural assumptions the tracer relies on.
 */
public final class MethodBodyValidator {

    private MethodBodyValidator() {
        // Utility class
    }

    /**
     * Validates that offsets strictly increase, that every branch target and exception handler
     * names an instruction of the method, and that stack effects are not negative.
     *
     * @throws MalformedMethodBodyException on the first violation found
     */
    public static void validate(MethodInfo method) {
        List<Instruction> instructions = method.instructions();
        int previous = Integer.MIN_VALUE;
        for (Instruction ins : instructions) {
            if (ins.offset() <= previous) {
                throw new MalformedMethodBodyException(method, String.format(
                        "offset %d does not follow %d", ins.offset(), previous));
            }
            previous = ins.offset();
            if (ins.stackPop() < 0 || ins.stackPush() < 0) {
                throw new MalformedMethodBodyException(method, "negative stack effect at " + ins);
            }
        }

        for (Instruction ins : instructions) {
            if (ins.operand() instanceof BranchTarget target) {
                for (int offset : target.offsets()) {
                    if (method.indexOf(offset) < 0) {
                        throw new MalformedMethodBodyException(method, String.format(
                                "branch at %d targets missing offset %d", ins.offset(), offset));
                    }
                }
            }
        }

        for (int handler : method.handlerOffsets()) {
            if (method.indexOf(handler) < 0) {
                throw new MalformedMethodBodyException(method, "handler at missing offset " + handler);
            }
        }
    }
}

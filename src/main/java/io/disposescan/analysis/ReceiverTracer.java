package io.disposescan.analysis;

import io.disposescan.model.Instruction;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.OpCode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the instruction that produced the receiver of a call or field access.
 * <p>
 * The search walks backward from the consuming instruction, one method body only, counting
 * operand-stack words: the receiver is the deepest word the consumer pops, so the producer is
 * the instruction at which the words pushed since then cover exactly that many. Stack effects
 * are taken at face value along the straight-line code preceding the consumer. The walk gives
 * up instead of guessing when
 * <ul>
 *   <li>it would step over an instruction that does not fall through (goto, switch, return,
 *       throw), since the code after it is reached some other way;</li>
 *   <li>it would step back past a branch target or handler entry, where values may come from
 *       more than one predecessor;</li>
 *   <li>the producer pushes more than the receiver word (a long or double, dup2 and friends);</li>
 *   <li>it runs off the start of the method.</li>
 * </ul>
 * A plain {@code dup} is transparent: its outputs are copies of its input, so the search
 * continues with the value it duplicated.
 * <p>
 * Stateless; one instance can serve any number of threads.
 */
public class ReceiverTracer {

    /**
     * Returns true if the receiver of {@code consumer} is provably the method's own {@code this}.
     * Inconclusive traces answer false.
     */
    public boolean isSelfReceiver(Instruction consumer, MethodInfo method) {
        return traceReceiver(consumer, method)
                .map(producer -> producer.opCode() == OpCode.LOAD_SELF)
                .orElse(false);
    }

    /**
     * Returns the instruction that pushed the deepest operand consumed by {@code consumer},
     * or empty if it cannot be determined from straight-line code.
     */
    public Optional<Instruction> traceReceiver(Instruction consumer, MethodInfo method) {
        int index = method.indexOf(consumer.offset());
        if (index < 0 || consumer.stackPop() <= 0) {
            return Optional.empty();
        }

        List<Instruction> instructions = method.instructions();
        Set<Integer> mergePoints = method.branchTargets();
        if (mergePoints.contains(consumer.offset())) {
            return Optional.empty();
        }

        // Words still to be accounted for; the receiver is the last of them
        int needed = consumer.stackPop();
        while (index > 0) {
            Instruction ins = instructions.get(--index);
            if (!ins.flow().fallsThrough()) {
                return Optional.empty();
            }

            needed -= ins.stackPush();
            if (needed <= 0) {
                if (ins.isDup()) {
                    needed = 1;
                } else if (needed == 0) {
                    return Optional.of(ins);
                } else {
                    return Optional.empty();
                }
            } else {
                needed += ins.stackPop();
            }

            if (mergePoints.contains(ins.offset())) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}

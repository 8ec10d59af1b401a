package io.disposescan.model;

/**
 * How control leaves an instruction.
 */
public enum FlowControl {
    /** Falls through to the next instruction */
    NEXT,
    /** Jumps or falls through */
    CONDITIONAL_BRANCH,
    /** Unconditional jump (goto, jsr) */
    BRANCH,
    /** tableswitch / lookupswitch */
    SWITCH,
    RETURN,
    THROW;

    /**
     * Returns true if the following instruction can be reached from this one without a jump.
     */
    public boolean fallsThrough() {
        return this == NEXT || this == CONDITIONAL_BRANCH;
    }
}

package io.github.manjago.gbacore.cpu;

/**
 * Outcome of executing one decoded instruction.
 */
public enum ExecutionResult {

    /** Instruction ran; PC advances to the next word */
    EXECUTED(false),

    /** Instruction wrote R15; the default PC advance is suppressed */
    BRANCHED(true),

    /** Condition field did not pass */
    SKIPPED(false),

    /** Encoding outside the modelled subset; ran as a no-op */
    UNIMPLEMENTED(false);

    private final boolean redirectsPc;

    ExecutionResult(boolean redirectsPc) {
        this.redirectsPc = redirectsPc;
    }

    /**
     * @return true if the instruction already set the next PC itself
     */
    public boolean redirectsPc() {
        return redirectsPc;
    }
}

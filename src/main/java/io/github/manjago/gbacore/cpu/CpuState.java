package io.github.manjago.gbacore.cpu;

/**
 * Register file and status register of the ARM core.
 * <p>
 * Contains:
 * - 16 registers R0-R15 (R13 = SP, R14 = LR, R15 = PC)
 * - CPSR: bit 31 = N, bit 30 = Z, bit 29 = C, bit 28 = V, low bits = mode
 * - counters for executed and unimplemented instructions
 * <p>
 * Pipeline model: R15 always holds the address of the instruction being
 * executed plus 8. Jumps go through {@link #jumpTo(int)} so that the next
 * instruction executed is the target.
 */
public final class CpuState {

    public static final int REGISTER_COUNT = 16;

    public static final int SP = 13;
    public static final int LR = 14;
    public static final int PC = 15;

    public static final int FLAG_N = 0x8000_0000;
    public static final int FLAG_Z = 0x4000_0000;
    public static final int FLAG_C = 0x2000_0000;
    public static final int FLAG_V = 0x1000_0000;

    /** User mode, ARM state, interrupts enabled */
    public static final int USER_MODE = 0x10;

    /** Distance between R15 and the executing instruction */
    public static final int PIPELINE_OFFSET = 8;

    private final int[] registers;

    private int cpsr;

    /** Instructions stepped, including skipped and unimplemented ones */
    private long executed;

    /** Instructions that decoded to something not modelled */
    private long unimplemented;

    public CpuState() {
        this.registers = new int[REGISTER_COUNT];
        reset(0);
    }

    /**
     * Copy constructor - creates independent copy of state.
     */
    public CpuState(CpuState other) {
        this.registers = other.registers.clone();
        this.cpsr = other.cpsr;
        this.executed = other.executed;
        this.unimplemented = other.unimplemented;
    }

    // ========== Register Access ==========

    public int getRegister(int index) {
        return registers[index & 0x0F];
    }

    public void setRegister(int index, int value) {
        registers[index & 0x0F] = value;
    }

    // ========== Program counter ==========

    /**
     * Raw R15 (executing address + 8).
     */
    public int getPc() {
        return registers[PC];
    }

    public void setPc(int value) {
        registers[PC] = value;
    }

    /**
     * Address of the instruction the next step executes.
     */
    public int getInstructionAddress() {
        return registers[PC] - PIPELINE_OFFSET;
    }

    /**
     * Make {@code target} the next instruction executed.
     */
    public void jumpTo(int target) {
        registers[PC] = target + PIPELINE_OFFSET;
    }

    // ========== Status register ==========

    public int getCpsr() {
        return cpsr;
    }

    public void setCpsr(int cpsr) {
        this.cpsr = cpsr;
    }

    public boolean isNegative() {
        return (cpsr & FLAG_N) != 0;
    }

    public boolean isZero() {
        return (cpsr & FLAG_Z) != 0;
    }

    public boolean isCarry() {
        return (cpsr & FLAG_C) != 0;
    }

    public boolean isOverflow() {
        return (cpsr & FLAG_V) != 0;
    }

    /**
     * Set Z if {@code result == 0} and N from bit 31; C and V are untouched.
     */
    public void updateZeroNegative(int result) {
        cpsr &= ~(FLAG_Z | FLAG_N);
        if (result == 0) {
            cpsr |= FLAG_Z;
        }
        cpsr |= result & FLAG_N;
    }

    // ========== Counters ==========

    public long getExecuted() {
        return executed;
    }

    public void incrementExecuted() {
        executed++;
    }

    public long getUnimplemented() {
        return unimplemented;
    }

    public void incrementUnimplemented() {
        unimplemented++;
    }

    // ========== Utility ==========

    /**
     * Full reset: all registers to 0, CPSR to user mode, counters to 0,
     * next instruction at {@code entryAddress}.
     */
    public void reset(int entryAddress) {
        for (int i = 0; i < REGISTER_COUNT; i++) {
            registers[i] = 0;
        }
        cpsr = USER_MODE;
        executed = 0;
        unimplemented = 0;
        jumpTo(entryAddress);
    }

    /**
     * Copy of R0-R15.
     */
    public int[] snapshotRegisters() {
        return registers.clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("CpuState{PC=").append(String.format("0x%08X", getInstructionAddress()));
        sb.append(", CPSR=").append(String.format("0x%08X", cpsr));
        sb.append(", R=[");
        for (int i = 0; i < REGISTER_COUNT; i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%08X", registers[i]));
        }
        sb.append("], executed=").append(executed);
        sb.append(", unimplemented=").append(unimplemented);
        sb.append('}');
        return sb.toString();
    }
}

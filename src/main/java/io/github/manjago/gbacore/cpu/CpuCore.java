package io.github.manjago.gbacore.cpu;

import io.github.manjago.gbacore.cpu.Instruction.*;
import io.github.manjago.gbacore.memory.Bus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ARM7TDMI-class interpreter (ARM state only).
 * <p>
 * Each {@link #step()} fetches the word at {@code R15 - 8}, checks its
 * condition, decodes it into an {@link Instruction} and executes it through
 * the bus. Unless the instruction wrote R15 itself, R15 then advances by 4.
 * <p>
 * While an instruction executes R15 still holds its address + 8, so any
 * operand naming R15 reads that value without special casing.
 */
public final class CpuCore {

    private static final Logger log = LoggerFactory.getLogger(CpuCore.class);

    private final Bus bus;

    private final CpuState state = new CpuState();

    /** Handler for SWI (BIOS services) */
    private final SoftwareInterruptHandler swiHandler;

    /** Cycles charged per instruction */
    private final int cyclesPerInstruction;

    /**
     * Create a core with the built-in BIOS services.
     */
    public CpuCore(Bus bus, int cyclesPerInstruction) {
        this(bus, cyclesPerInstruction, new BiosServices());
    }

    public CpuCore(Bus bus, int cyclesPerInstruction, SoftwareInterruptHandler swiHandler) {
        if (cyclesPerInstruction <= 0) {
            throw new IllegalArgumentException("cyclesPerInstruction must be positive: " + cyclesPerInstruction);
        }
        this.bus = bus;
        this.cyclesPerInstruction = cyclesPerInstruction;
        this.swiHandler = swiHandler;
    }

    /**
     * Reset registers and counters; the next instruction executed is at {@code entryAddress}.
     */
    public void reset(int entryAddress) {
        state.reset(entryAddress);
    }

    /**
     * Execute exactly one instruction.
     * <p>
     * Never throws: failures inside an instruction are logged, counted as
     * unimplemented and execution continues with the next word.
     *
     * @return cycles consumed
     */
    public int step() {
        int address = state.getInstructionAddress();
        try {
            int word = bus.read32(address);
            ExecutionResult result = execute(word, address);
            if (!result.redirectsPc()) {
                state.setPc(state.getPc() + 4);
            }
            if (result == ExecutionResult.UNIMPLEMENTED) {
                state.incrementUnimplemented();
                if (log.isDebugEnabled()) {
                    log.debug("Unimplemented instruction 0x{} at 0x{}",
                            Integer.toHexString(word), Integer.toHexString(address));
                }
            }
        } catch (RuntimeException e) {
            log.warn("Instruction at 0x{} failed, skipping it", Integer.toHexString(address), e);
            state.incrementUnimplemented();
            state.jumpTo(address + 4);
        }
        state.incrementExecuted();
        return cyclesPerInstruction;
    }

    /**
     * Execute one instruction word as if fetched from {@code address}.
     * R15 must already equal {@code address + 8}.
     */
    ExecutionResult execute(int word, int address) {
        if (!Condition.of(word).test(state.getCpsr())) {
            return ExecutionResult.SKIPPED;
        }
        Instruction instruction = InstructionDecoder.decode(word);

        if (instruction instanceof Branch b) {
            return executeBranch(b, address);
        } else if (instruction instanceof BranchExchange bx) {
            return executeBranchExchange(bx);
        } else if (instruction instanceof DataProcessing dp) {
            return executeDataProcessing(dp);
        } else if (instruction instanceof StatusToRegister mrs) {
            state.setRegister(mrs.rd(), state.getCpsr());
            return ExecutionResult.EXECUTED;
        } else if (instruction instanceof RegisterToStatus msr) {
            return executeMoveToStatus(msr);
        } else if (instruction instanceof Multiply mul) {
            return executeMultiply(mul);
        } else if (instruction instanceof SingleTransfer st) {
            return executeSingleTransfer(st);
        } else if (instruction instanceof HalfwordTransfer ht) {
            return executeHalfwordTransfer(ht);
        } else if (instruction instanceof BlockTransfer bt) {
            return executeBlockTransfer(bt);
        } else if (instruction instanceof SoftwareInterrupt swi) {
            return executeSoftwareInterrupt(swi);
        }
        return ExecutionResult.UNIMPLEMENTED;
    }

    // ========== Branches ==========

    private ExecutionResult executeBranch(Branch b, int address) {
        if (b.link()) {
            state.setRegister(CpuState.LR, address + 4);
        }
        state.jumpTo(address + CpuState.PIPELINE_OFFSET + b.offset());
        return ExecutionResult.BRANCHED;
    }

    private ExecutionResult executeBranchExchange(BranchExchange bx) {
        int target = state.getRegister(bx.rm());
        if ((target & 1) != 0) {
            log.debug("BX to Thumb state at 0x{} not supported", Integer.toHexString(target));
            return ExecutionResult.UNIMPLEMENTED;
        }
        state.jumpTo(target & ~3);
        return ExecutionResult.BRANCHED;
    }

    // ========== Data processing ==========

    private ExecutionResult executeDataProcessing(DataProcessing dp) {
        DataOpcode opcode = dp.opcode();
        if (opcode.needsCarry()) {
            return ExecutionResult.UNIMPLEMENTED;
        }
        int op1 = state.getRegister(dp.rn());
        int op2 = operandValue(dp.operand2());

        int result = switch (opcode) {
            case AND, TST -> op1 & op2;
            case EOR, TEQ -> op1 ^ op2;
            case SUB, CMP -> op1 - op2;
            case RSB -> op2 - op1;
            case ADD, CMN -> op1 + op2;
            case ORR -> op1 | op2;
            case MOV -> op2;
            case BIC -> op1 & ~op2;
            case MVN -> ~op2;
            case ADC, SBC, RSC -> throw new IllegalStateException("carry opcode " + opcode);
        };

        if (dp.setFlags()) {
            state.updateZeroNegative(result);
        }
        if (!opcode.writesResult()) {
            return ExecutionResult.EXECUTED;
        }
        if (dp.rd() == CpuState.PC) {
            state.jumpTo(result & ~3);
            return ExecutionResult.BRANCHED;
        }
        state.setRegister(dp.rd(), result);
        return ExecutionResult.EXECUTED;
    }

    private ExecutionResult executeMoveToStatus(RegisterToStatus msr) {
        int mask = 0;
        for (int field = 0; field < 4; field++) {
            if ((msr.fieldMask() & (1 << field)) != 0) {
                mask |= 0xFF << (8 * field);
            }
        }
        int value = operandValue(msr.source());
        state.setCpsr(state.getCpsr() & ~mask | value & mask);
        return ExecutionResult.EXECUTED;
    }

    private ExecutionResult executeMultiply(Multiply mul) {
        int result = state.getRegister(mul.rm()) * state.getRegister(mul.rs());
        if (mul.accumulate()) {
            result += state.getRegister(mul.rn());
        }
        if (mul.setFlags()) {
            state.updateZeroNegative(result);
        }
        state.setRegister(mul.rd(), result);
        return ExecutionResult.EXECUTED;
    }

    private int operandValue(Operand operand) {
        if (operand instanceof Operand.Immediate imm) {
            return imm.value();
        } else if (operand instanceof Operand.ShiftedRegister sr) {
            return sr.shift().applyImmediate(state.getRegister(sr.rm()), sr.amount(), state.isCarry());
        } else if (operand instanceof Operand.RegisterShiftedRegister rsr) {
            return rsr.shift().applyRegister(state.getRegister(rsr.rm()), state.getRegister(rsr.rs()));
        }
        throw new IllegalArgumentException("Unknown operand " + operand);
    }

    // ========== Loads and stores ==========

    private ExecutionResult executeSingleTransfer(SingleTransfer st) {
        int base = state.getRegister(st.rn());
        int offset = operandValue(st.offset());
        int updated = st.up() ? base + offset : base - offset;
        int address = st.preIndex() ? updated : base;

        if (!st.load()) {
            int value = state.getRegister(st.rd());
            if (st.byteSize()) {
                bus.write8(address, value);
            } else {
                bus.write32(address, value);
            }
            writeBack(st.rn(), updated, !st.preIndex() || st.writeBack());
            return ExecutionResult.EXECUTED;
        }

        int value = st.byteSize()
                ? bus.read8(address)
                : Integer.rotateRight(bus.read32(address), 8 * (address & 3));
        writeBack(st.rn(), updated, !st.preIndex() || st.writeBack());
        return loadInto(st.rd(), value);
    }

    private ExecutionResult executeHalfwordTransfer(HalfwordTransfer ht) {
        int base = state.getRegister(ht.rn());
        int offset = operandValue(ht.offset());
        int updated = ht.up() ? base + offset : base - offset;
        int address = ht.preIndex() ? updated : base;

        if (!ht.load()) {
            bus.write16(address, state.getRegister(ht.rd()) & 0xFFFF);
            writeBack(ht.rn(), updated, !ht.preIndex() || ht.writeBack());
            return ExecutionResult.EXECUTED;
        }

        int value = switch (ht.kind()) {
            case UNSIGNED_HALFWORD -> bus.read16(address);
            case SIGNED_BYTE -> (byte) bus.read8(address);
            case SIGNED_HALFWORD -> (short) bus.read16(address);
        };
        writeBack(ht.rn(), updated, !ht.preIndex() || ht.writeBack());
        return loadInto(ht.rd(), value);
    }

    private ExecutionResult executeBlockTransfer(BlockTransfer bt) {
        int count = bt.registerCount();
        if (count == 0) {
            return ExecutionResult.UNIMPLEMENTED;
        }
        int base = state.getRegister(bt.rn());
        int span = 4 * count;
        int address;
        if (bt.up()) {
            address = bt.preIndex() ? base + 4 : base;
        } else {
            address = bt.preIndex() ? base - span : base - span + 4;
        }
        int updated = bt.up() ? base + span : base - span;

        if (!bt.load()) {
            for (int r = 0; r < CpuState.REGISTER_COUNT; r++) {
                if (bt.includes(r)) {
                    bus.write32(address, state.getRegister(r));
                    address += 4;
                }
            }
            writeBack(bt.rn(), updated, bt.writeBack());
            return ExecutionResult.EXECUTED;
        }

        // Loaded values win over the written-back base
        writeBack(bt.rn(), updated, bt.writeBack());
        ExecutionResult result = ExecutionResult.EXECUTED;
        for (int r = 0; r < CpuState.REGISTER_COUNT; r++) {
            if (bt.includes(r)) {
                result = loadInto(r, bus.read32(address));
                address += 4;
            }
        }
        return result;
    }

    private void writeBack(int rn, int value, boolean enabled) {
        if (enabled && rn != CpuState.PC) {
            state.setRegister(rn, value);
        }
    }

    /**
     * Assign a loaded value; loading R15 is a jump to the word-aligned value.
     */
    private ExecutionResult loadInto(int rd, int value) {
        if (rd == CpuState.PC) {
            state.jumpTo(value & ~3);
            return ExecutionResult.BRANCHED;
        }
        state.setRegister(rd, value);
        return ExecutionResult.EXECUTED;
    }

    // ========== SWI ==========

    private ExecutionResult executeSoftwareInterrupt(SoftwareInterrupt swi) {
        int function = swi.function();
        if (swiHandler.handle(function, state, bus)) {
            return ExecutionResult.EXECUTED;
        }
        log.debug("SWI 0x{} not provided", Integer.toHexString(function));
        return ExecutionResult.UNIMPLEMENTED;
    }

    // ========== Getters ==========

    public CpuState getState() {
        return state;
    }

    public int getCyclesPerInstruction() {
        return cyclesPerInstruction;
    }
}

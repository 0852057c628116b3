package io.github.manjago.gbacore.debug;

import io.github.manjago.gbacore.cpu.CpuState;

/**
 * One executed instruction in a trace.
 * 
 * Captures what ran and the machine state right after it:
 * registers, status register and beam position.
 */
public record TraceEntry(
    long step,             // 0-based index since the trace started
    int address,           // where the instruction was fetched
    int word,              // encoded instruction
    String disassembly,
    int[] registers,       // R0-R15 after execution
    int cpsr,
    int scanline,          // VCOUNT after execution
    boolean unimplemented  // executed as a no-op
) {

    /**
     * Address of the next instruction to execute.
     */
    public int nextAddress() {
        return registers[CpuState.PC] - CpuState.PIPELINE_OFFSET;
    }

    /**
     * True when the instruction redirected execution.
     */
    public boolean branched() {
        return nextAddress() != address + 4;
    }
}

package io.github.manjago.gbacore.cpu;

import io.github.manjago.gbacore.memory.Bus;

/**
 * Handler for SWI instructions.
 * <p>
 * BIOS services touch memory and registers outside the instruction stream,
 * so the CPU delegates them to this interface.
 */
public interface SoftwareInterruptHandler {

    /**
     * Run BIOS function {@code function}.
     *
     * @param function function number taken from the SWI comment field
     * @param state registers of the calling code; results are written back here
     * @param bus memory the service reads and writes
     * @return true if the function is provided, false if it is not implemented
     */
    boolean handle(int function, CpuState state, Bus bus);

    /**
     * Handler that provides nothing. Every SWI becomes a no-op.
     */
    SoftwareInterruptHandler NONE = (function, state, bus) -> false;
}

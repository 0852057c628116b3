package io.github.manjago.gbacore.cpu;

import io.github.manjago.gbacore.memory.Bus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level replacements for the BIOS calls boot code relies on.
 * <p>
 * Implemented functions:
 * - 0x06 Div: R0 = R0 / R1, R1 = R0 % R1, R3 = |R0 / R1|
 * - 0x08 Sqrt: R0 = floor(sqrt(R0)), R0 unsigned
 * - 0x0B CpuSet: copy or fill of 16- or 32-bit units
 * - 0x0C CpuFastSet: copy or fill of 32-bit units in blocks of eight
 */
public final class BiosServices implements SoftwareInterruptHandler {

    private static final Logger log = LoggerFactory.getLogger(BiosServices.class);

    public static final int DIV = 0x06;
    public static final int SQRT = 0x08;
    public static final int CPU_SET = 0x0B;
    public static final int CPU_FAST_SET = 0x0C;

    /** R2 bits 0-20: number of units */
    private static final int COUNT_MASK = 0x1F_FFFF;
    /** R2 bit 24: fill with the first source unit instead of copying */
    private static final int FILL_BIT = 1 << 24;
    /** R2 bit 26: 32-bit units (CpuSet only) */
    private static final int WORD_BIT = 1 << 26;

    @Override
    public boolean handle(int function, CpuState state, Bus bus) {
        switch (function) {
            case DIV -> divide(state);
            case SQRT -> squareRoot(state);
            case CPU_SET -> cpuSet(state, bus);
            case CPU_FAST_SET -> cpuFastSet(state, bus);
            default -> {
                return false;
            }
        }
        return true;
    }

    /**
     * CpuSet: R0 = source, R1 = destination, R2 = control.
     */
    private void cpuSet(CpuState state, Bus bus) {
        int control = state.getRegister(2);
        int count = control & COUNT_MASK;
        boolean fill = (control & FILL_BIT) != 0;

        if ((control & WORD_BIT) != 0) {
            transferWords(bus, state.getRegister(0), state.getRegister(1), count, fill);
        } else {
            int src = state.getRegister(0) & ~1;
            int dst = state.getRegister(1) & ~1;
            for (int i = 0; i < count; i++) {
                bus.write16(dst, bus.read16(src));
                dst += 2;
                if (!fill) {
                    src += 2;
                }
            }
        }
        log.debug("CpuSet: {} {}-bit units from 0x{} to 0x{} ({})",
                count, (control & WORD_BIT) != 0 ? 32 : 16,
                Integer.toHexString(state.getRegister(0)), Integer.toHexString(state.getRegister(1)),
                fill ? "fill" : "copy");
    }

    /**
     * CpuFastSet: like CpuSet with 32-bit units, count rounded up to a multiple of 8.
     */
    private void cpuFastSet(CpuState state, Bus bus) {
        int control = state.getRegister(2);
        int count = ((control & COUNT_MASK) + 7) & ~7;
        boolean fill = (control & FILL_BIT) != 0;
        transferWords(bus, state.getRegister(0), state.getRegister(1), count, fill);
        log.debug("CpuFastSet: {} words ({})", count, fill ? "fill" : "copy");
    }

    private static void transferWords(Bus bus, int source, int destination, int count, boolean fill) {
        int src = source & ~3;
        int dst = destination & ~3;
        for (int i = 0; i < count; i++) {
            bus.write32(dst, bus.read32(src));
            dst += 4;
            if (!fill) {
                src += 4;
            }
        }
    }

    private void divide(CpuState state) {
        int numerator = state.getRegister(0);
        int denominator = state.getRegister(1);
        if (denominator == 0) {
            log.debug("Div by zero ignored (numerator {})", numerator);
            return;
        }
        int quotient = numerator / denominator;
        state.setRegister(0, quotient);
        state.setRegister(1, numerator % denominator);
        state.setRegister(3, Math.abs(quotient));
    }

    private void squareRoot(CpuState state) {
        long value = Integer.toUnsignedLong(state.getRegister(0));
        long root = (long) Math.sqrt((double) value);
        // Correct for double rounding near perfect squares
        while (root * root > value) {
            root--;
        }
        while ((root + 1) * (root + 1) <= value) {
            root++;
        }
        state.setRegister(0, (int) root);
    }
}

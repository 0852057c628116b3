package io.github.manjago.gbacore.cpu;

/**
 * Second operand of data-processing instructions and offset of transfers.
 */
public sealed interface Operand {

    /**
     * Constant, already rotated for data-processing encodings.
     */
    record Immediate(int value) implements Operand {}

    /**
     * Register shifted by a 5-bit constant.
     */
    record ShiftedRegister(int rm, ShiftType shift, int amount) implements Operand {

        public boolean isPlain() {
            return shift == ShiftType.LSL && amount == 0;
        }
    }

    /**
     * Register shifted by the bottom byte of another register.
     */
    record RegisterShiftedRegister(int rm, ShiftType shift, int rs) implements Operand {}
}

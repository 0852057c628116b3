package io.github.manjago.gbacore.cpu;

/**
 * Barrel shifter operations (bits 5-6 of a register operand).
 * <p>
 * Shift carry-out is not produced.
 */
public enum ShiftType {

    LSL,
    LSR,
    ASR,
    ROR;

    private static final ShiftType[] BY_CODE = values();

    public static ShiftType of(int code) {
        return BY_CODE[code & 0x03];
    }

    /**
     * Shift by a 5-bit immediate. Amount 0 encodes LSR #32, ASR #32 and RRX
     * for the non-LSL types.
     */
    public int applyImmediate(int value, int amount, boolean carryIn) {
        return switch (this) {
            case LSL -> value << amount;
            case LSR -> amount == 0 ? 0 : value >>> amount;
            case ASR -> amount == 0 ? value >> 31 : value >> amount;
            case ROR -> amount == 0
                    ? (carryIn ? 0x8000_0000 : 0) | value >>> 1
                    : Integer.rotateRight(value, amount);
        };
    }

    /**
     * Shift by the bottom byte of a register. Amount 0 leaves the value alone.
     */
    public int applyRegister(int value, int amount) {
        int n = amount & 0xFF;
        if (n == 0) {
            return value;
        }
        return switch (this) {
            case LSL -> n >= 32 ? 0 : value << n;
            case LSR -> n >= 32 ? 0 : value >>> n;
            case ASR -> n >= 32 ? value >> 31 : value >> n;
            case ROR -> Integer.rotateRight(value, n);
        };
    }

    public String getMnemonic() {
        return name();
    }
}

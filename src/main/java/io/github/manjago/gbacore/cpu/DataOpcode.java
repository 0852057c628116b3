package io.github.manjago.gbacore.cpu;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Data-processing opcodes (bits 21-24).
 * <p>
 * ADC, SBC and RSC consume the carry flag, which is not modelled; they decode
 * but execute as no-ops.
 */
public enum DataOpcode {

    // ========== Logical ==========

    /** Rd = Rn AND Op2 */
    AND(0x0, "AND", true),

    /** Rd = Rn EOR Op2 */
    EOR(0x1, "EOR", true),

    // ========== Arithmetic ==========

    /** Rd = Rn - Op2 */
    SUB(0x2, "SUB", true),

    /** Rd = Op2 - Rn */
    RSB(0x3, "RSB", true),

    /** Rd = Rn + Op2 */
    ADD(0x4, "ADD", true),

    /** Rd = Rn + Op2 + C */
    ADC(0x5, "ADC", true),

    /** Rd = Rn - Op2 + C - 1 */
    SBC(0x6, "SBC", true),

    /** Rd = Op2 - Rn + C - 1 */
    RSC(0x7, "RSC", true),

    // ========== Comparison (flags only) ==========

    /** Flags from Rn AND Op2 */
    TST(0x8, "TST", false),

    /** Flags from Rn EOR Op2 */
    TEQ(0x9, "TEQ", false),

    /** Flags from Rn - Op2 */
    CMP(0xA, "CMP", false),

    /** Flags from Rn + Op2 */
    CMN(0xB, "CMN", false),

    // ========== Logical / move ==========

    /** Rd = Rn OR Op2 */
    ORR(0xC, "ORR", true),

    /** Rd = Op2 */
    MOV(0xD, "MOV", true),

    /** Rd = Rn AND NOT Op2 */
    BIC(0xE, "BIC", true),

    /** Rd = NOT Op2 */
    MVN(0xF, "MVN", true);

    private final int code;
    private final String mnemonic;
    private final boolean writesResult;

    DataOpcode(int code, String mnemonic, boolean writesResult) {
        this.code = code;
        this.mnemonic = mnemonic;
        this.writesResult = writesResult;
    }

    public int getCode() {
        return code;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * False for TST, TEQ, CMP and CMN, which only set flags.
     */
    public boolean writesResult() {
        return writesResult;
    }

    /**
     * True for MOV and MVN, which ignore Rn.
     */
    public boolean isMove() {
        return this == MOV || this == MVN;
    }

    /**
     * True for the carry-consuming opcodes.
     */
    public boolean needsCarry() {
        return this == ADC || this == SBC || this == RSC;
    }

    // ========== Lookup ==========

    private static final DataOpcode[] BY_CODE = new DataOpcode[16];

    static {
        for (DataOpcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    @Contract(pure = true)
    public static @NotNull DataOpcode fromCode(int code) {
        return BY_CODE[code & 0x0F];
    }
}

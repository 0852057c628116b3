package io.github.manjago.gbacore.cpu;

/**
 * Builds ARM instruction words for tests, always with the AL condition
 * unless {@link #withCondition} is applied.
 */
public final class ArmEncoder {

    public static final int AL = 0xE000_0000;

    // Data-processing opcodes
    public static final int AND = 0x0, EOR = 0x1, SUB = 0x2, RSB = 0x3, ADD = 0x4, ADC = 0x5,
            SBC = 0x6, RSC = 0x7, TST = 0x8, TEQ = 0x9, CMP = 0xA, CMN = 0xB, ORR = 0xC,
            MOV = 0xD, BIC = 0xE, MVN = 0xF;

    private ArmEncoder() {
    }

    public static int withCondition(int word, Condition condition) {
        return word & 0x0FFF_FFFF | condition.ordinal() << 28;
    }

    // ========== Data processing ==========

    /** op Rd, Rn, #(imm8 ROR 2*rotate) */
    public static int dpImm(int opcode, boolean setFlags, int rd, int rn, int imm8, int rotate) {
        return AL | 1 << 25 | opcode << 21 | (setFlags ? 1 << 20 : 0)
                | rn << 16 | rd << 12 | rotate << 8 | imm8 & 0xFF;
    }

    /** op Rd, Rn, Rm, shift #amount */
    public static int dpReg(int opcode, boolean setFlags, int rd, int rn, int rm, ShiftType shift, int amount) {
        return AL | opcode << 21 | (setFlags ? 1 << 20 : 0)
                | rn << 16 | rd << 12 | amount << 7 | shift.ordinal() << 5 | rm;
    }

    /** op Rd, Rn, Rm, shift Rs */
    public static int dpRegShiftReg(int opcode, int rd, int rn, int rm, ShiftType shift, int rs) {
        return AL | opcode << 21 | rn << 16 | rd << 12 | rs << 8 | shift.ordinal() << 5 | 1 << 4 | rm;
    }

    public static int dpReg(int opcode, boolean setFlags, int rd, int rn, int rm) {
        return dpReg(opcode, setFlags, rd, rn, rm, ShiftType.LSL, 0);
    }

    public static int movImm(int rd, int imm8) {
        return dpImm(MOV, false, rd, 0, imm8, 0);
    }

    /** MOV Rd, #(imm8 ROR 2*rotate) */
    public static int movImm(int rd, int imm8, int rotate) {
        return dpImm(MOV, false, rd, 0, imm8, rotate);
    }

    public static int movsImm(int rd, int imm8) {
        return dpImm(MOV, true, rd, 0, imm8, 0);
    }

    public static int movReg(int rd, int rm) {
        return dpReg(MOV, false, rd, 0, rm);
    }

    public static int addImm(int rd, int rn, int imm8) {
        return dpImm(ADD, false, rd, rn, imm8, 0);
    }

    public static int subImm(int rd, int rn, int imm8) {
        return dpImm(SUB, false, rd, rn, imm8, 0);
    }

    public static int subsImm(int rd, int rn, int imm8) {
        return dpImm(SUB, true, rd, rn, imm8, 0);
    }

    public static int cmpImm(int rn, int imm8) {
        return dpImm(CMP, true, 0, rn, imm8, 0);
    }

    public static int cmpReg(int rn, int rm) {
        return dpReg(CMP, true, 0, rn, rm);
    }

    // ========== Status register ==========

    public static int mrs(int rd) {
        return AL | 0x010F_0000 | rd << 12;
    }

    /** MSR CPSR_f, #(imm8 ROR 2*rotate) */
    public static int msrFlagsImm(int imm8, int rotate) {
        return AL | 0x0328_F000 | rotate << 8 | imm8 & 0xFF;
    }

    /** MSR CPSR_fc, Rm */
    public static int msrReg(int rm) {
        return AL | 0x0129_F000 | rm;
    }

    // ========== Branches ==========

    public static int branch(int from, int target) {
        return AL | 0x0A00_0000 | (target - from - 8) >> 2 & 0x00FF_FFFF;
    }

    public static int branchLink(int from, int target) {
        return branch(from, target) | 1 << 24;
    }

    public static int bx(int rm) {
        return AL | 0x012F_FF10 | rm;
    }

    // ========== Multiply ==========

    public static int mul(int rd, int rm, int rs) {
        return AL | rd << 16 | rs << 8 | 0x90 | rm;
    }

    public static int mla(int rd, int rm, int rs, int rn) {
        return mul(rd, rm, rs) | 1 << 21 | rn << 12;
    }

    // ========== Loads and stores ==========

    public static int singleTransfer(boolean load, boolean byteSize, boolean preIndex, boolean up,
                                     boolean writeBack, int rn, int rd, int imm12) {
        return AL | 0x0400_0000 | (preIndex ? 1 << 24 : 0) | (up ? 1 << 23 : 0)
                | (byteSize ? 1 << 22 : 0) | (writeBack ? 1 << 21 : 0) | (load ? 1 << 20 : 0)
                | rn << 16 | rd << 12 | imm12 & 0xFFF;
    }

    /** LDR Rd, [Rn, #offset] */
    public static int ldr(int rd, int rn, int offset) {
        return singleTransfer(true, false, true, true, false, rn, rd, offset);
    }

    /** STR Rd, [Rn, #offset] */
    public static int str(int rd, int rn, int offset) {
        return singleTransfer(false, false, true, true, false, rn, rd, offset);
    }

    /** LDR Rd, [Rn, Rm] */
    public static int ldrReg(int rd, int rn, int rm) {
        return AL | 0x0790_0000 | rn << 16 | rd << 12 | rm;
    }

    /**
     * Halfword / signed transfer with an immediate offset.
     *
     * @param sh 1 = H, 2 = SB, 3 = SH
     */
    public static int halfwordImm(boolean load, int sh, boolean preIndex, boolean up, boolean writeBack,
                                  int rn, int rd, int imm8) {
        return AL | (preIndex ? 1 << 24 : 0) | (up ? 1 << 23 : 0) | 1 << 22
                | (writeBack ? 1 << 21 : 0) | (load ? 1 << 20 : 0)
                | rn << 16 | rd << 12 | (imm8 & 0xF0) << 4 | 1 << 7 | sh << 5 | 1 << 4 | imm8 & 0x0F;
    }

    public static int blockTransfer(boolean load, boolean preIndex, boolean up, boolean writeBack,
                                    int rn, int registerList) {
        return AL | 0x0800_0000 | (preIndex ? 1 << 24 : 0) | (up ? 1 << 23 : 0)
                | (writeBack ? 1 << 21 : 0) | (load ? 1 << 20 : 0) | rn << 16 | registerList & 0xFFFF;
    }

    /** STMDB Rn!, {list} (push) */
    public static int push(int rn, int registerList) {
        return blockTransfer(false, true, false, true, rn, registerList);
    }

    /** LDMIA Rn!, {list} (pop) */
    public static int pop(int rn, int registerList) {
        return blockTransfer(true, false, true, true, rn, registerList);
    }

    // ========== SWI ==========

    /** SWI with the function number in bits 16-23, as ARM-state code calls the BIOS */
    public static int swi(int function) {
        return AL | 0x0F00_0000 | (function & 0xFF) << 16;
    }

    /**
     * Little-endian bytes of consecutive instruction words (a ROM image).
     */
    public static byte[] assemble(int... words) {
        byte[] bytes = new byte[words.length * 4];
        for (int i = 0; i < words.length; i++) {
            bytes[4 * i] = (byte) words[i];
            bytes[4 * i + 1] = (byte) (words[i] >>> 8);
            bytes[4 * i + 2] = (byte) (words[i] >>> 16);
            bytes[4 * i + 3] = (byte) (words[i] >>> 24);
        }
        return bytes;
    }
}

package io.github.manjago.gbacore.cpu;

/**
 * Decoded ARM instruction.
 * <p>
 * One record per instruction category; {@link InstructionDecoder} produces
 * them from raw words and {@link CpuCore} dispatches on the record type.
 * The condition field is not part of the record, see {@link Condition#of(int)}.
 */
public sealed interface Instruction {

    /**
     * B / BL. {@code offset} is in bytes, sign-extended, relative to the
     * executing address + 8.
     */
    record Branch(boolean link, int offset) implements Instruction {}

    /**
     * BX Rm.
     */
    record BranchExchange(int rm) implements Instruction {}

    /**
     * AND, EOR, SUB, RSB, ADD, ADC, SBC, RSC, TST, TEQ, CMP, CMN, ORR, MOV, BIC, MVN.
     */
    record DataProcessing(DataOpcode opcode, boolean setFlags, int rn, int rd, Operand operand2)
            implements Instruction {}

    /**
     * MRS Rd, CPSR.
     */
    record StatusToRegister(int rd) implements Instruction {}

    /**
     * MSR CPSR_fields, Op. {@code fieldMask} is bits 16-19 of the encoding
     * (c = 1, x = 2, s = 4, f = 8).
     */
    record RegisterToStatus(int fieldMask, Operand source) implements Instruction {}

    /**
     * MUL / MLA.
     */
    record Multiply(boolean accumulate, boolean setFlags, int rd, int rn, int rs, int rm)
            implements Instruction {}

    /**
     * LDR, STR, LDRB, STRB.
     */
    record SingleTransfer(boolean load, boolean byteSize, boolean preIndex, boolean up,
                          boolean writeBack, int rn, int rd, Operand offset) implements Instruction {}

    /**
     * LDRH, STRH, LDRSB, LDRSH.
     */
    record HalfwordTransfer(boolean load, HalfwordKind kind, boolean preIndex, boolean up,
                            boolean writeBack, int rn, int rd, Operand offset) implements Instruction {}

    /**
     * LDM / STM.
     */
    record BlockTransfer(boolean load, boolean preIndex, boolean up, boolean writeBack,
                         int rn, int registerList) implements Instruction {

        public int registerCount() {
            return Integer.bitCount(registerList);
        }

        public boolean includes(int register) {
            return (registerList & (1 << register)) != 0;
        }
    }

    /**
     * SWI with its 24-bit comment field.
     */
    record SoftwareInterrupt(int comment) implements Instruction {

        /**
         * BIOS function number: bits 16-23 of the comment (ARM-state
         * convention), or the low byte when those bits are zero.
         */
        public int function() {
            int high = (comment >>> 16) & 0xFF;
            return high != 0 ? high : comment & 0xFF;
        }
    }

    /**
     * Encoding outside the modelled subset. Executes as a no-op.
     */
    record Undefined(int word) implements Instruction {}

    /**
     * Transfer size and signedness of halfword-class loads and stores (SH bits).
     */
    enum HalfwordKind {
        UNSIGNED_HALFWORD("H"),
        SIGNED_BYTE("SB"),
        SIGNED_HALFWORD("SH");

        private final String suffix;

        HalfwordKind(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }
    }
}

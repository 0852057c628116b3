package io.github.manjago.gbacore.cpu;

import io.github.manjago.gbacore.cpu.Instruction.*;
import org.jetbrains.annotations.NotNull;

/**
 * Disassembler for the ARM subset the interpreter decodes.
 * <p>
 * Converts instruction words to assembly text such as {@code "MOVS R0, #0x0"}
 * or {@code "STMDB R13!, {R4, R14}"}.
 */
public final class Disassembler {

    private Disassembler() {
        // Utility class
    }

    /**
     * Disassemble a single instruction.
     *
     * @param word encoded 32-bit instruction
     * @param address address the instruction executes at (for branch targets)
     * @return assembly string
     */
    public static @NotNull String disassemble(int word, int address) {
        String cond = Condition.of(word).getSuffix();
        Instruction instruction = InstructionDecoder.decode(word);

        if (instruction instanceof Branch b) {
            int target = address + CpuState.PIPELINE_OFFSET + b.offset();
            return String.format("B%s%s 0x%08X", b.link() ? "L" : "", cond, target);
        }
        if (instruction instanceof BranchExchange bx) {
            return String.format("BX%s R%d", cond, bx.rm());
        }
        if (instruction instanceof DataProcessing dp) {
            return dataProcessing(dp, cond);
        }
        if (instruction instanceof StatusToRegister mrs) {
            return String.format("MRS%s R%d, CPSR", cond, mrs.rd());
        }
        if (instruction instanceof RegisterToStatus msr) {
            return String.format("MSR%s CPSR_%s, %s", cond, fields(msr.fieldMask()), operand(msr.source()));
        }
        if (instruction instanceof Multiply mul) {
            String s = mul.setFlags() ? "S" : "";
            return mul.accumulate()
                    ? String.format("MLA%s%s R%d, R%d, R%d, R%d", cond, s, mul.rd(), mul.rm(), mul.rs(), mul.rn())
                    : String.format("MUL%s%s R%d, R%d, R%d", cond, s, mul.rd(), mul.rm(), mul.rs());
        }
        if (instruction instanceof SingleTransfer st) {
            String mnemonic = (st.load() ? "LDR" : "STR") + cond + (st.byteSize() ? "B" : "");
            return transfer(mnemonic, st.rd(), st.rn(), st.offset(), st.preIndex(), st.up(), st.writeBack());
        }
        if (instruction instanceof HalfwordTransfer ht) {
            String mnemonic = (ht.load() ? "LDR" : "STR") + cond + ht.kind().getSuffix();
            return transfer(mnemonic, ht.rd(), ht.rn(), ht.offset(), ht.preIndex(), ht.up(), ht.writeBack());
        }
        if (instruction instanceof BlockTransfer bt) {
            String mode = (bt.up() ? "I" : "D") + (bt.preIndex() ? "B" : "A");
            return String.format("%s%s%s R%d%s, %s",
                    bt.load() ? "LDM" : "STM", cond, mode, bt.rn(), bt.writeBack() ? "!" : "",
                    registerList(bt.registerList()));
        }
        if (instruction instanceof SoftwareInterrupt swi) {
            return String.format("SWI%s 0x%06X", cond, swi.comment());
        }
        return String.format("??? 0x%08X", word);
    }

    /**
     * Disassemble consecutive words with addresses and hex dump.
     *
     * @param words encoded instructions
     * @param baseAddress address of the first word
     * @return multi-line listing
     */
    public static @NotNull String disassembleWithHex(int[] words, int baseAddress) {
        if (words == null || words.length == 0) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            int address = baseAddress + 4 * i;
            sb.append(String.format("%08X: %08X  %s", address, words[i], disassemble(words[i], address)));
        }
        return sb.toString();
    }

    // ========== Pieces ==========

    private static String dataProcessing(DataProcessing dp, String cond) {
        DataOpcode op = dp.opcode();
        String op2 = operand(dp.operand2());
        if (op.isMove()) {
            return String.format("%s%s%s R%d, %s", op.getMnemonic(), cond, dp.setFlags() ? "S" : "", dp.rd(), op2);
        }
        if (!op.writesResult()) {
            return String.format("%s%s R%d, %s", op.getMnemonic(), cond, dp.rn(), op2);
        }
        return String.format("%s%s%s R%d, R%d, %s",
                op.getMnemonic(), cond, dp.setFlags() ? "S" : "", dp.rd(), dp.rn(), op2);
    }

    private static String operand(Operand operand) {
        if (operand instanceof Operand.Immediate imm) {
            return String.format("#0x%X", imm.value());
        }
        if (operand instanceof Operand.ShiftedRegister sr) {
            if (sr.isPlain()) {
                return "R" + sr.rm();
            }
            if (sr.amount() == 0 && sr.shift() == ShiftType.ROR) {
                return String.format("R%d, RRX", sr.rm());
            }
            int amount = sr.amount() == 0 ? 32 : sr.amount();
            return String.format("R%d, %s #%d", sr.rm(), sr.shift().getMnemonic(), amount);
        }
        Operand.RegisterShiftedRegister rsr = (Operand.RegisterShiftedRegister) operand;
        return String.format("R%d, %s R%d", rsr.rm(), rsr.shift().getMnemonic(), rsr.rs());
    }

    private static String transfer(String mnemonic, int rd, int rn, Operand offset,
                                   boolean preIndex, boolean up, boolean writeBack) {
        String sign = up ? "" : "-";
        String off;
        if (offset instanceof Operand.Immediate imm) {
            off = imm.value() == 0 ? "" : String.format(", #%s0x%X", sign, imm.value());
        } else {
            off = ", " + sign + operand(offset);
        }
        if (preIndex) {
            return String.format("%s R%d, [R%d%s]%s", mnemonic, rd, rn, off, writeBack ? "!" : "");
        }
        return String.format("%s R%d, [R%d]%s", mnemonic, rd, rn, off);
    }

    private static String registerList(int list) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (int r = 0; r < CpuState.REGISTER_COUNT; r++) {
            if ((list & (1 << r)) != 0) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append('R').append(r);
                first = false;
            }
        }
        return sb.append('}').toString();
    }

    private static String fields(int mask) {
        StringBuilder sb = new StringBuilder();
        if ((mask & 8) != 0) sb.append('f');
        if ((mask & 4) != 0) sb.append('s');
        if ((mask & 2) != 0) sb.append('x');
        if ((mask & 1) != 0) sb.append('c');
        return sb.toString();
    }
}

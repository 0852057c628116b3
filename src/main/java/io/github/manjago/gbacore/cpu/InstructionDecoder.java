package io.github.manjago.gbacore.cpu;

import io.github.manjago.gbacore.cpu.Instruction.*;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Classifies 32-bit ARM words into {@link Instruction} records.
 * <p>
 * Fixed bit-field masks, checked most specific first:
 * <pre>
 * cccc 1111 xxxx ...                  SWI
 * cccc 101L oooo ...                  B / BL
 * cccc 100P USWL ...                  LDM / STM
 * cccc 01IP UBWL ...                  LDR / STR (B)
 * cccc 0001 0010 1111 1111 1111 0001  BX
 * cccc 0000 00AS .... .... 1001 ....  MUL / MLA
 * cccc 000P UIWL .... .... 1SH1 ....  LDRH / STRH / LDRSB / LDRSH
 * cccc 00Io oooS ...                  data processing, MRS, MSR
 * </pre>
 */
public final class InstructionDecoder {

    private InstructionDecoder() {
        // Utility class
    }

    @Contract(pure = true)
    public static @NotNull Instruction decode(int word) {
        if ((word & 0x0F00_0000) == 0x0F00_0000) {
            return new SoftwareInterrupt(word & 0x00FF_FFFF);
        }
        if ((word & 0x0E00_0000) == 0x0A00_0000) {
            return decodeBranch(word);
        }
        if ((word & 0x0E00_0000) == 0x0800_0000) {
            return decodeBlockTransfer(word);
        }
        if ((word & 0x0C00_0000) == 0x0400_0000) {
            return decodeSingleTransfer(word);
        }
        if ((word & 0x0C00_0000) == 0x0000_0000) {
            return decodeGroupZero(word);
        }
        // Coprocessor space
        return new Undefined(word);
    }

    private static Instruction decodeBranch(int word) {
        boolean link = bit(word, 24);
        // Sign-extend the 24-bit word offset and scale to bytes in one go
        int offset = (word << 8) >> 6;
        return new Branch(link, offset);
    }

    private static Instruction decodeBlockTransfer(int word) {
        return new BlockTransfer(
                bit(word, 20),
                bit(word, 24),
                bit(word, 23),
                bit(word, 21),
                rn(word),
                word & 0xFFFF);
    }

    private static Instruction decodeSingleTransfer(int word) {
        boolean registerOffset = bit(word, 25);
        if (registerOffset && bit(word, 4)) {
            return new Undefined(word);
        }
        Operand offset = registerOffset
                ? new Operand.ShiftedRegister(word & 0x0F, ShiftType.of(word >>> 5), (word >>> 7) & 0x1F)
                : new Operand.Immediate(word & 0x0FFF);
        return new SingleTransfer(
                bit(word, 20),
                bit(word, 22),
                bit(word, 24),
                bit(word, 23),
                bit(word, 21),
                rn(word),
                rd(word),
                offset);
    }

    private static Instruction decodeGroupZero(int word) {
        if ((word & 0x0FFF_FFF0) == 0x012F_FF10) {
            return new BranchExchange(word & 0x0F);
        }
        if ((word & 0x0E00_0090) == 0x0000_0090) {
            return decodeMultiplyOrHalfword(word);
        }
        return decodeDataProcessing(word);
    }

    private static Instruction decodeMultiplyOrHalfword(int word) {
        int sh = (word >>> 5) & 0x03;
        if (sh == 0) {
            if ((word & 0x0FC0_00F0) == 0x0000_0090) {
                return new Multiply(
                        bit(word, 21),
                        bit(word, 20),
                        (word >>> 16) & 0x0F,
                        (word >>> 12) & 0x0F,
                        (word >>> 8) & 0x0F,
                        word & 0x0F);
            }
            // Long multiply, swap
            return new Undefined(word);
        }

        boolean load = bit(word, 20);
        HalfwordKind kind = switch (sh) {
            case 1 -> HalfwordKind.UNSIGNED_HALFWORD;
            case 2 -> HalfwordKind.SIGNED_BYTE;
            default -> HalfwordKind.SIGNED_HALFWORD;
        };
        if (!load && kind != HalfwordKind.UNSIGNED_HALFWORD) {
            // Doubleword transfers belong to later architectures
            return new Undefined(word);
        }
        Operand offset = bit(word, 22)
                ? new Operand.Immediate((word >>> 4) & 0xF0 | word & 0x0F)
                : new Operand.ShiftedRegister(word & 0x0F, ShiftType.LSL, 0);
        return new HalfwordTransfer(
                load,
                kind,
                bit(word, 24),
                bit(word, 23),
                bit(word, 21),
                rn(word),
                rd(word),
                offset);
    }

    private static Instruction decodeDataProcessing(int word) {
        DataOpcode opcode = DataOpcode.fromCode(word >>> 21);
        boolean setFlags = bit(word, 20);
        Operand operand2 = decodeOperand2(word);

        if (!setFlags && !opcode.writesResult()) {
            // The comparison slots without S hold the status register transfers
            switch (opcode) {
                case TST -> {
                    return new StatusToRegister(rd(word));
                }
                case TEQ -> {
                    return new RegisterToStatus((word >>> 16) & 0x0F, operand2);
                }
                case CMP -> {
                    // CMP always updates flags
                    return new DataProcessing(opcode, true, rn(word), rd(word), operand2);
                }
                default -> {
                    // MSR SPSR: banked registers are not modelled
                    return new Undefined(word);
                }
            }
        }
        return new DataProcessing(opcode, setFlags, rn(word), rd(word), operand2);
    }

    private static Operand decodeOperand2(int word) {
        if (bit(word, 25)) {
            int rotate = ((word >>> 8) & 0x0F) * 2;
            return new Operand.Immediate(Integer.rotateRight(word & 0xFF, rotate));
        }
        int rm = word & 0x0F;
        ShiftType shift = ShiftType.of(word >>> 5);
        if (bit(word, 4)) {
            return new Operand.RegisterShiftedRegister(rm, shift, (word >>> 8) & 0x0F);
        }
        return new Operand.ShiftedRegister(rm, shift, (word >>> 7) & 0x1F);
    }

    // ========== Field helpers ==========

    private static boolean bit(int word, int index) {
        return (word & (1 << index)) != 0;
    }

    private static int rn(int word) {
        return (word >>> 16) & 0x0F;
    }

    private static int rd(int word) {
        return (word >>> 12) & 0x0F;
    }
}

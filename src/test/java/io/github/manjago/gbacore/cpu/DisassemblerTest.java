package io.github.manjago.gbacore.cpu;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DisassemblerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "0xE3B00000 | MOVS R0, #0x0",
        "0xE1510002 | CMP R1, R2",
        "0xE0821003 | ADD R1, R2, R3",
        "0xE1A00101 | MOV R0, R1, LSL #2",
        "0xE1A00061 | MOV R0, R1, RRX",
        "0xE5B10004 | LDR R0, [R1, #0x4]!",
        "0xE4110004 | LDR R0, [R1], #-0x4",
        "0xE1D100B2 | LDRH R0, [R1, #0x2]",
        "0xE92D4010 | STMDB R13!, {R4, R14}",
        "0xE8BD8010 | LDMIA R13!, {R4, R15}",
        "0xEF0B0000 | SWI 0x0B0000",
        "0xE12FFF1E | BX R14",
        "0xE0000291 | MUL R0, R1, R2",
        "0xE10F3000 | MRS R3, CPSR",
        "0x13A00001 | MOVNE R0, #0x1",
        "0xEC000000 | ??? 0xEC000000",
    })
    @DisplayName("Disassembles the supported instruction forms")
    void disassembles(String word, String expected) {
        assertEquals(expected, Disassembler.disassemble(Integer.parseUnsignedInt(word.trim().substring(2), 16), 0));
    }

    @Test
    @DisplayName("Branch target is absolute")
    void branchTarget() {
        int word = ArmEncoder.branchLink(0x0800_0000, 0x0800_00C0);

        assertEquals("BL 0x080000C0", Disassembler.disassemble(word, 0x0800_0000));
    }

    @Test
    @DisplayName("Listing shows address, word and text per line")
    void listing() {
        String listing = Disassembler.disassembleWithHex(
                new int[] {0xE3B0_0000, ArmEncoder.branch(0x0800_0004, 0x0800_0004)}, 0x0800_0000);

        assertEquals("""
                08000000: E3B00000  MOVS R0, #0x0
                08000004: EAFFFFFE  B 0x08000004""", listing);
    }

    @Test
    @DisplayName("Empty listing")
    void emptyListing() {
        assertEquals("", Disassembler.disassembleWithHex(new int[0], 0));
    }
}

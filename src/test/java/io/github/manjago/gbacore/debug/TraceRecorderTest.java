package io.github.manjago.gbacore.debug;

import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.sim.Emulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.manjago.gbacore.cpu.ArmEncoder.*;
import static io.github.manjago.gbacore.memory.AddressMap.ROM_BASE;
import static org.junit.jupiter.api.Assertions.*;

class TraceRecorderTest {

    private Emulator emulator;

    @BeforeEach
    void setUp() {
        emulator = new Emulator(EmulatorConfig.builder().frameRate(0).build());
        emulator.loadRom(assemble(
                movImm(0, 1),                           // 0x08000000
                addImm(0, 0, 1),                        // 0x08000004
                branch(ROM_BASE + 8, ROM_BASE + 4)));   // 0x08000008
    }

    private List<TraceEntry> record(TraceRecorder recorder) {
        while (!recorder.isComplete()) {
            recorder.step(emulator);
        }
        return recorder.getEntries();
    }

    @Test
    @DisplayName("Records address, word and state after each instruction")
    void recordsEntries() {
        List<TraceEntry> entries = record(new TraceRecorder(0, 5));

        assertEquals(5, entries.size());
        assertEquals(ROM_BASE, entries.get(0).address());
        assertEquals(movImm(0, 1), entries.get(0).word());
        assertEquals("MOV R0, #0x1", entries.get(0).disassembly());
        assertEquals(1, entries.get(0).registers()[0]);
        assertEquals(2, entries.get(1).registers()[0]);
        assertEquals(3, entries.get(4).registers()[0]);
        assertEquals(4, entries.get(4).step());
    }

    @Test
    @DisplayName("Branches are detected from the next address")
    void branches() {
        List<TraceEntry> entries = record(new TraceRecorder(0, 3));

        assertFalse(entries.get(0).branched());
        assertEquals(ROM_BASE + 4, entries.get(0).nextAddress());
        assertTrue(entries.get(2).branched());
        assertEquals(ROM_BASE + 4, entries.get(2).nextAddress());
    }

    @Test
    @DisplayName("Skipped instructions execute but are not recorded")
    void skip() {
        TraceRecorder recorder = new TraceRecorder(2, 2);

        List<TraceEntry> entries = record(recorder);

        assertEquals(4, recorder.getSteps());
        assertEquals(ROM_BASE + 8, entries.get(0).address());
        assertEquals(0, entries.get(0).step());
        assertEquals(ROM_BASE + 4, entries.get(1).address());
    }

    @Test
    @DisplayName("No-op instructions are flagged")
    void unimplemented() {
        emulator.loadRom(assemble(0xEC00_0000));

        List<TraceEntry> entries = record(new TraceRecorder(0, 1));

        assertTrue(entries.get(0).unimplemented());
        assertEquals("??? 0xEC000000", entries.get(0).disassembly());
    }

    @Test
    @DisplayName("Entries are read-only and clear starts over")
    void clear() {
        TraceRecorder recorder = new TraceRecorder(0, 2);
        record(recorder);

        assertThrows(UnsupportedOperationException.class, () -> recorder.getEntries().clear());

        recorder.clear();
        assertFalse(recorder.isComplete());
        assertEquals(0, recorder.getSteps());
    }

    @Test
    @DisplayName("Invalid limits are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TraceRecorder(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> new TraceRecorder(0, 0));
    }
}

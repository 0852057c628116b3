package io.github.manjago.gbacore.sim;

import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.cpu.CpuState;
import io.github.manjago.gbacore.memory.AddressMap;
import io.github.manjago.gbacore.memory.IoRegisters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.manjago.gbacore.cpu.ArmEncoder.*;
import static io.github.manjago.gbacore.memory.AddressMap.ROM_BASE;
import static org.junit.jupiter.api.Assertions.*;

class EmulatorTest {

    /** B . at the cartridge entry point */
    private static final byte[] SPIN = assemble(branch(ROM_BASE, ROM_BASE));

    /** Bytes per mode 3 row */
    private static final int FRAME_ROW_BYTES = 240 * 2;

    private static final EmulatorConfig UNTHROTTLED = EmulatorConfig.builder()
            .frameRate(0)
            .build();

    private Emulator emulator;

    @BeforeEach
    void setUp() {
        emulator = new Emulator(UNTHROTTLED);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Without BIOS execution starts at the cartridge with the IWRAM stack")
        void skipBios() {
            emulator.loadRom(SPIN);

            CpuState state = emulator.getCpu().getState();
            assertEquals(ROM_BASE, state.getInstructionAddress());
            assertEquals(AddressMap.IWRAM_STACK_TOP, state.getRegister(CpuState.SP));
            assertEquals(CpuState.USER_MODE, state.getCpsr());
        }

        @Test
        @DisplayName("With a BIOS execution starts at address 0")
        void withBios() {
            emulator.loadBios(assemble(branch(0, 0)));
            emulator.loadRom(SPIN);

            assertEquals(0, emulator.getCpu().getState().getInstructionAddress());
        }

        @Test
        @DisplayName("Empty ROM is rejected and nothing changes")
        void emptyRom() {
            emulator.loadRom(SPIN);
            emulator.runFrame();
            DebugState before = emulator.getDebugState();

            assertThrows(InvalidRomException.class, () -> emulator.loadRom(new byte[0]));
            assertThrows(InvalidRomException.class, () -> emulator.loadRom(null));

            assertEquals(before, emulator.getDebugState());
            assertEquals(1, emulator.getHostFrames());
            assertEquals(SPIN.length, emulator.getBus().getRomLength());
        }

        @Test
        @DisplayName("The caller's array is copied")
        void romCopied() {
            byte[] image = assemble(movImm(0, 1), branch(ROM_BASE + 4, ROM_BASE + 4));
            emulator.loadRom(image);

            image[0] = 0x7F;

            assertEquals(movImm(0, 1), emulator.getBus().read32(ROM_BASE));
        }

        @Test
        @DisplayName("Reloading restarts the machine")
        void reload() {
            emulator.loadRom(SPIN);
            emulator.runFrame();
            emulator.getBus().write32(AddressMap.EWRAM_BASE, 42);

            emulator.loadRom(SPIN);

            assertEquals(0, emulator.getHostFrames());
            assertEquals(0, emulator.getTotalCycles());
            assertEquals(0, emulator.getBus().read32(AddressMap.EWRAM_BASE));
            assertEquals(0, emulator.getPpu().getCurrentScanline());
        }
    }

    @Nested
    @DisplayName("Host frames")
    class HostFrames {

        @Test
        @DisplayName("A spinning ROM uses the whole cycle budget and returns")
        @Timeout(5)
        void spinningRom() {
            emulator.loadRom(SPIN);

            int instructions = emulator.runFrame();

            assertEquals(UNTHROTTLED.cyclesPerFrame() / UNTHROTTLED.cyclesPerInstruction(), instructions);
            assertEquals(ROM_BASE, emulator.getCpu().getState().getInstructionAddress());
            assertEquals(1, emulator.getPpu().getFrameCount());
            assertEquals(0, emulator.getStats().budgetCutFrames());
        }

        @Test
        @DisplayName("The instruction cap ends a frame early")
        void instructionCap() {
            Emulator capped = new Emulator(UNTHROTTLED.toBuilder().maxInstructionsPerFrame(1000).build());
            capped.loadRom(SPIN);

            assertEquals(1000, capped.runFrame());
            assertEquals(4000, capped.getTotalCycles());
            assertEquals(1, capped.getStats().budgetCutFrames());
            assertEquals(0, capped.getPpu().getFrameCount());
        }

        @Test
        @DisplayName("Undefined words execute as counted no-ops")
        void undefinedWords() {
            emulator.loadRom(assemble(0xEC00_0000));

            int instructions = emulator.runFrame();

            EmulatorStats stats = emulator.getStats();
            assertEquals(instructions, stats.instructions());
            assertEquals(instructions, stats.unimplemented());
            assertEquals(100.0, stats.unimplementedPercent(), 1e-9);
        }

        @Test
        @DisplayName("Program drawing in mode 3 reaches the display sink")
        void modeThreePicture() {
            int loop = ROM_BASE + 24;
            emulator.loadRom(assemble(
                    movImm(0, 0x04, 4),          // R0 = 0x04000000
                    movImm(1, 3),
                    str(1, 0, 0),                // DISPCNT = mode 3
                    movImm(2, 0x06, 4),          // R2 = 0x06000000
                    movImm(3, 0x1F),
                    str(3, 2, FRAME_ROW_BYTES),  // pixel (0, 1) = red
                    branch(loop, loop)));

            List<Integer> pixels = new ArrayList<>();
            emulator.setDisplaySink(frame -> {
                pixels.add(frame.getRgb(0, 1));
                pixels.add(frame.getRgb(1, 1));
            });

            emulator.runFrame();

            assertEquals(List.of(0xFF0000, 0x000000), pixels);
            assertEquals(3, emulator.getBus().read16(AddressMap.IO_BASE + IoRegisters.DISPCNT));
        }

        @Test
        @DisplayName("Listener sees every frame in order")
        void listenerFrames() {
            List<Long> frames = new ArrayList<>();
            emulator.setListener(new EmulatorListener() {
                @Override
                public void onFrame(long frame, int instructions) {
                    frames.add(frame);
                }
            });
            emulator.loadRom(SPIN);

            emulator.runFrame();
            emulator.runFrame();

            assertEquals(List.of(1L, 2L), frames);
        }
    }

    @Nested
    @DisplayName("Run loop")
    class RunLoop {

        @Test
        @DisplayName("Runs the requested number of frames")
        @Timeout(10)
        void fixedFrames() {
            emulator.loadRom(SPIN);

            emulator.run(3);

            assertEquals(3, emulator.getHostFrames());
            assertFalse(emulator.isRunning());
        }

        @Test
        @DisplayName("Progress is reported every interval")
        @Timeout(10)
        void progressReports() {
            Emulator reporting = new Emulator(UNTHROTTLED.toBuilder().reportInterval(2).build());
            AtomicInteger reports = new AtomicInteger();
            reporting.setListener(new EmulatorListener() {
                @Override
                public void onProgress(EmulatorStats stats) {
                    reports.incrementAndGet();
                    assertEquals(reports.get() * 2L, stats.hostFrames());
                }
            });
            reporting.loadRom(SPIN);

            reporting.run(5);

            assertEquals(2, reports.get());
        }

        @Test
        @DisplayName("stop ends an unbounded run after the current frame")
        @Timeout(10)
        void stopFromListener() {
            emulator.setListener(new EmulatorListener() {
                @Override
                public void onFrame(long frame, int instructions) {
                    if (frame == 4) {
                        emulator.stop();
                    }
                }
            });
            emulator.loadRom(SPIN);

            emulator.run(0);

            assertEquals(4, emulator.getHostFrames());
            assertTrue(emulator.getStats().elapsedMillis() >= 0);
        }

        @Test
        @DisplayName("pause and resume toggle the flag")
        void pauseResume() {
            emulator.pause();
            assertTrue(emulator.isPaused());

            emulator.resume();
            assertFalse(emulator.isPaused());
        }
    }

    @Test
    @DisplayName("Key state lands in KEYINPUT, active-low")
    void keyState() {
        emulator.loadRom(SPIN);

        emulator.setKeyState(0x03FE);
        assertEquals(0x03FE, emulator.getBus().read16(AddressMap.IO_BASE + IoRegisters.KEYINPUT));

        emulator.setKeyState(0xFFFF);
        assertEquals(IoRegisters.KEYS_RELEASED, emulator.getBus().read16(AddressMap.IO_BASE + IoRegisters.KEYINPUT));
    }

    @Test
    @DisplayName("Program stores cannot overwrite the host key state")
    void keyStateSurvivesStores() {
        emulator.loadRom(SPIN);
        emulator.setKeyState(0x03F7);

        emulator.getBus().write16(AddressMap.IO_BASE + IoRegisters.KEYINPUT, 0);
        emulator.getBus().write32(AddressMap.IO_BASE + IoRegisters.KEYINPUT, 0);

        assertEquals(0x03F7, emulator.getBus().read16(AddressMap.IO_BASE + IoRegisters.KEYINPUT));
    }

    @Test
    @DisplayName("Debug state describes the machine")
    void debugState() {
        emulator.loadRom(SPIN);
        emulator.stepInstruction();

        DebugState state = emulator.getDebugState();

        assertEquals(ROM_BASE, state.pc());
        assertEquals(1, state.instructions());
        assertEquals(0, state.vcount());
        assertEquals("PC=0x08000000 CPSR=0x00000010 VCOUNT=0 frame=0 instructions=1", state.toString());
    }

    @Test
    @DisplayName("Statistics carry the ROM size and DMA count")
    void stats() {
        emulator.loadRom(SPIN);
        emulator.runFrame();

        EmulatorStats stats = emulator.getStats();

        assertEquals(1, stats.hostFrames());
        assertEquals(SPIN.length, stats.romSize());
        assertEquals(0, stats.dmaTransfers());
        assertEquals(UNTHROTTLED.cyclesPerFrame(), stats.cycles());
        assertTrue(stats.toString().contains("Host frames:"));
    }
}

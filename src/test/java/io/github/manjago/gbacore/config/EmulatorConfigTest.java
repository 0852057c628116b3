package io.github.manjago.gbacore.config;

import io.github.manjago.gbacore.video.DisplayTiming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EmulatorConfigTest {

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("reference.conf matches the builder defaults")
        void defaults() {
            EmulatorConfig config = EmulatorConfig.defaults();

            assertEquals(EmulatorConfig.builder().build(), config);
            assertEquals(4, config.cyclesPerInstruction());
            assertEquals(279_620, config.cyclesPerFrame());
            assertTrue(config.skipBios());
        }

        @Test
        @DisplayName("File values override the defaults")
        void fromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("fast.conf");
            Files.writeString(file, """
                gbacore {
                  frame.rate = 0
                  cpu.cycles-per-instruction = 2
                }
                """);

            EmulatorConfig config = EmulatorConfig.fromFile(file);

            assertEquals(0, config.frameRate());
            assertEquals(2, config.cyclesPerInstruction());
            assertEquals(1232, config.cyclesPerScanline());
            assertEquals(200_000, config.maxInstructionsPerFrame());
        }

        @Test
        @DisplayName("Invalid file values are rejected")
        void invalidFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("bad.conf");
            Files.writeString(file, "gbacore.video.hdraw-cycles = 5000\n");

            assertThrows(IllegalArgumentException.class, () -> EmulatorConfig.fromFile(file));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Cycle counts must be positive")
        void positive() {
            assertThrows(IllegalArgumentException.class,
                    () -> EmulatorConfig.builder().cyclesPerInstruction(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> EmulatorConfig.builder().cyclesPerFrame(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> EmulatorConfig.builder().reportInterval(0).build());
        }

        @Test
        @DisplayName("Draw period must be shorter than the line")
        void hdraw() {
            assertThrows(IllegalArgumentException.class,
                    () -> EmulatorConfig.builder().hdrawCycles(1232).build());
        }

        @Test
        @DisplayName("Frame rate 0 means unthrottled, negative is an error")
        void frameRate() {
            EmulatorConfig config = EmulatorConfig.builder().frameRate(0).build();

            assertTrue(config.toString().contains("unthrottled"));
            assertThrows(IllegalArgumentException.class,
                    () -> EmulatorConfig.builder().frameRate(-1).build());
        }
    }

    @Test
    @DisplayName("Derived values")
    void derived() {
        EmulatorConfig config = EmulatorConfig.builder().build();

        assertEquals(DisplayTiming.STANDARD, config.displayTiming());

        EmulatorConfig shorter = config.withCyclesPerFrame(1000);
        assertEquals(1000, shorter.cyclesPerFrame());
        assertEquals(config.maxInstructionsPerFrame(), shorter.maxInstructionsPerFrame());
        assertEquals(config, shorter.toBuilder().cyclesPerFrame(config.cyclesPerFrame()).build());
    }
}

package io.github.manjago.gbacore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.gbacore.video.DisplayTiming;

import java.nio.file.Path;

/**
 * Configuration for the emulator core and its host loop.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record EmulatorConfig(
    // CPU
    int cyclesPerInstruction,

    // Display timing
    int cyclesPerScanline,
    int hdrawCycles,

    // Host frame budget
    int cyclesPerFrame,
    int maxInstructionsPerFrame,
    int frameRate,             // host frames per second, 0 = unthrottled

    // Boot
    boolean skipBios,

    // Reporting
    int reportInterval         // frames between progress reports
) {

    public EmulatorConfig {
        requirePositive("cpu.cycles-per-instruction", cyclesPerInstruction);
        requirePositive("video.cycles-per-scanline", cyclesPerScanline);
        requirePositive("video.hdraw-cycles", hdrawCycles);
        if (hdrawCycles >= cyclesPerScanline) {
            throw new IllegalArgumentException(
                    "video.hdraw-cycles must be below video.cycles-per-scanline: " + hdrawCycles);
        }
        requirePositive("frame.cycles-per-frame", cyclesPerFrame);
        requirePositive("frame.max-instructions", maxInstructionsPerFrame);
        if (frameRate < 0) {
            throw new IllegalArgumentException("frame.rate must not be negative: " + frameRate);
        }
        requirePositive("reporting.interval", reportInterval);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }

    /**
     * Load default configuration.
     */
    public static EmulatorConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static EmulatorConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static EmulatorConfig fromConfig(Config config) {
        Config c = config.getConfig("gbacore");

        return new EmulatorConfig(
            c.getInt("cpu.cycles-per-instruction"),
            c.getInt("video.cycles-per-scanline"),
            c.getInt("video.hdraw-cycles"),
            c.getInt("frame.cycles-per-frame"),
            c.getInt("frame.max-instructions"),
            c.getInt("frame.rate"),
            c.getBoolean("boot.skip-bios"),
            c.getInt("reporting.interval")
        );
    }

    public DisplayTiming displayTiming() {
        return new DisplayTiming(cyclesPerScanline, hdrawCycles);
    }

    /**
     * Copy with a different per-frame cycle budget.
     */
    public EmulatorConfig withCyclesPerFrame(int cycles) {
        return toBuilder().cyclesPerFrame(cycles).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .cyclesPerInstruction(cyclesPerInstruction)
                .cyclesPerScanline(cyclesPerScanline)
                .hdrawCycles(hdrawCycles)
                .cyclesPerFrame(cyclesPerFrame)
                .maxInstructionsPerFrame(maxInstructionsPerFrame)
                .frameRate(frameRate)
                .skipBios(skipBios)
                .reportInterval(reportInterval);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int cyclesPerInstruction = 4;
        private int cyclesPerScanline = 1232;
        private int hdrawCycles = 960;
        private int cyclesPerFrame = 279_620;
        private int maxInstructionsPerFrame = 200_000;
        private int frameRate = 60;
        private boolean skipBios = true;
        private int reportInterval = 60;

        public Builder cyclesPerInstruction(int cycles) { this.cyclesPerInstruction = cycles; return this; }
        public Builder cyclesPerScanline(int cycles) { this.cyclesPerScanline = cycles; return this; }
        public Builder hdrawCycles(int cycles) { this.hdrawCycles = cycles; return this; }
        public Builder cyclesPerFrame(int cycles) { this.cyclesPerFrame = cycles; return this; }
        public Builder maxInstructionsPerFrame(int max) { this.maxInstructionsPerFrame = max; return this; }
        public Builder frameRate(int rate) { this.frameRate = rate; return this; }
        public Builder skipBios(boolean skip) { this.skipBios = skip; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public EmulatorConfig build() {
            return new EmulatorConfig(
                cyclesPerInstruction, cyclesPerScanline, hdrawCycles,
                cyclesPerFrame, maxInstructionsPerFrame, frameRate, skipBios, reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            EmulatorConfig:
              cpu.cycles-per-instruction: %d
              video.cycles-per-scanline:  %,d
              video.hdraw-cycles:         %,d
              frame.cycles-per-frame:     %,d
              frame.max-instructions:     %,d
              frame.rate:                 %s
              boot.skip-bios:             %s
              reporting.interval:         %,d frames
            """,
            cyclesPerInstruction,
            cyclesPerScanline,
            hdrawCycles,
            cyclesPerFrame,
            maxInstructionsPerFrame,
            frameRate == 0 ? "unthrottled" : frameRate + " fps",
            skipBios,
            reportInterval
        );
    }
}

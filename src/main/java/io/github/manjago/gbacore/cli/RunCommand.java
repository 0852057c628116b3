package io.github.manjago.gbacore.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.sim.*;
import io.github.manjago.gbacore.video.FrameBuffer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Run a ROM headless.
 * 
 * Examples:
 *   gbacore run game.gba                          # Run until Ctrl+C
 *   gbacore run game.gba -n 600                   # Run 600 frames
 *   gbacore run game.gba -n 60 --screenshot a.png # Save the last frame
 *   gbacore run game.gba --bios gba_bios.bin --realtime
 */
@Command(
    name = "run",
    description = "Run a ROM headless",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "ROM file (.gba, .bin or .zip)")
    private Path romFile;

    @Option(names = {"-b", "--bios"}, description = "BIOS image (16 KiB)")
    private Path biosFile;

    @Option(names = {"-n", "--frames"}, description = "Host frames to run (0 = until stopped)")
    private Long frames;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"--cycles-per-frame"}, description = "Cycle budget per host frame")
    private Integer cyclesPerFrame;

    @Option(names = {"--max-instructions"}, description = "Instruction cap per host frame")
    private Integer maxInstructions;

    @Option(names = {"--report-interval"}, description = "Progress report interval (frames)")
    private Integer reportInterval;

    @Option(names = {"-s", "--screenshot"}, description = "Write the last frame as PNG")
    private Path screenshotFile;

    @Option(names = {"--realtime"}, description = "Pace frames at frame.rate instead of running flat out")
    private boolean realtime;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        EmulatorConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return RomFiles.EXIT_UNSUPPORTED;
        }
        Emulator emulator = new Emulator(config);

        try {
            if (biosFile != null) {
                emulator.loadBios(RomFiles.loadBios(biosFile));
            }
            emulator.loadRom(RomFiles.loadRom(romFile));
        } catch (IllegalArgumentException e) {
            System.err.println("Cannot load: " + e.getMessage());
            return RomFiles.EXIT_UNSUPPORTED;
        } catch (IOException e) {
            System.err.println("Cannot read file: " + e.getMessage());
            return RomFiles.EXIT_IO_ERROR;
        }

        if (!quiet) {
            printBanner();
            printConfig(config);
            emulator.setListener(new ConsoleProgressListener());
        }

        LastFrameSink lastFrame = new LastFrameSink();
        if (screenshotFile != null) {
            emulator.setDisplaySink(lastFrame);
        }

        // Setup graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (emulator.isRunning()) {
                System.out.println("\nStopping gracefully...");
                emulator.stop();
            }
        }));

        long startTime = System.currentTimeMillis();
        emulator.run(frames != null ? frames : 0);
        long elapsed = System.currentTimeMillis() - startTime;

        if (screenshotFile != null) {
            try {
                lastFrame.write(screenshotFile);
                if (!quiet) {
                    System.out.println("Screenshot written to " + screenshotFile);
                }
            } catch (IOException e) {
                System.err.println("Cannot write screenshot: " + e.getMessage());
                return RomFiles.EXIT_IO_ERROR;
            }
        }

        if (!quiet) {
            printFinalReport(emulator, elapsed);
        }
        return 0;
    }

    private EmulatorConfig buildConfig() {
        EmulatorConfig base = configFile != null ? EmulatorConfig.fromFile(configFile) : EmulatorConfig.defaults();
        EmulatorConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (cyclesPerFrame != null) builder.cyclesPerFrame(cyclesPerFrame);
        if (maxInstructions != null) builder.maxInstructionsPerFrame(maxInstructions);
        if (reportInterval != null) builder.reportInterval(reportInterval);
        if (!realtime) builder.frameRate(0);

        return builder.build();
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║             GBACORE run               ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }

    private void printConfig(EmulatorConfig config) {
        System.out.println("Configuration:");
        System.out.printf("  ROM:             %s%n", romFile);
        System.out.printf("  BIOS:            %s%n", biosFile != null ? biosFile : "none (HLE services)");
        System.out.printf("  Frames:          %s%n",
                frames == null || frames == 0 ? "until stopped" : String.format("%,d", frames));
        System.out.printf("  Cycles / frame:  %,d%n", config.cyclesPerFrame());
        System.out.printf("  Pacing:          %s%n", config.frameRate() == 0 ? "flat out" : config.frameRate() + " fps");
        System.out.println();
    }

    private void printFinalReport(Emulator emulator, long elapsedMs) {
        EmulatorStats stats = emulator.getStats();

        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("           EMULATION STOPPED           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();
        System.out.printf("Time: %s  |  %,.1f frames/sec%n", formatDuration(elapsedMs),
                stats.hostFrames() * 1000.0 / Math.max(1, elapsedMs));
        System.out.println(stats);
        System.out.println("Final state: " + emulator.getDebugState());
        System.out.println("═══════════════════════════════════════");
    }

    private String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    /**
     * Console progress listener with live updates.
     */
    private static class ConsoleProgressListener implements EmulatorListener {
        private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};
        private int spinnerIdx = 0;

        @Override
        public void onProgress(EmulatorStats stats) {
            String spinner = SPINNER[spinnerIdx++ % SPINNER.length];

            System.out.printf("\r%s Frame %,d  |  %,d instructions  |  %,d no-ops  |  %,d DMA   ",
                    spinner,
                    stats.hostFrames(),
                    stats.instructions(),
                    stats.unimplemented(),
                    stats.dmaTransfers());
            System.out.flush();
        }
    }

    /**
     * Keeps a copy of the most recently presented frame.
     */
    static class LastFrameSink implements DisplaySink {
        private int[] argb;

        @Override
        public void present(FrameBuffer frame) {
            argb = frame.toArgb();
        }

        void write(Path file) throws IOException {
            if (argb == null) {
                throw new IOException("no frame was presented");
            }
            BufferedImage image = new BufferedImage(FrameBuffer.WIDTH, FrameBuffer.HEIGHT, BufferedImage.TYPE_INT_ARGB);
            image.setRGB(0, 0, FrameBuffer.WIDTH, FrameBuffer.HEIGHT, argb, 0, FrameBuffer.WIDTH);
            if (!ImageIO.write(image, "png", file.toFile())) {
                throw new IOException("no PNG writer available");
            }
        }
    }
}

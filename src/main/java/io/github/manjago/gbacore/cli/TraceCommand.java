package io.github.manjago.gbacore.cli;

import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.debug.TracePrinter;
import io.github.manjago.gbacore.debug.TraceRecorder;
import io.github.manjago.gbacore.sim.Emulator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: trace
 * 
 * Execute a ROM instruction by instruction and print what ran.
 * 
 * Usage:
 *   gbacore trace game.gba                     # First 50 instructions
 *   gbacore trace game.gba --steps 200         # First 200
 *   gbacore trace game.gba --from 10000 -s 20  # 20 instructions after skipping 10000
 *   gbacore trace game.gba --summary -o t.txt  # One line each, to a file
 */
@Command(
    name = "trace",
    description = "Run a ROM with per-instruction tracing",
    mixinStandardHelpOptions = true
)
public class TraceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "ROM file (.gba, .bin or .zip)")
    private Path romFile;

    @Option(names = {"-b", "--bios"}, description = "BIOS image (16 KiB)")
    private Path biosFile;

    @Option(names = {"-s", "--steps"}, description = "Instructions to record", defaultValue = "50")
    private int steps;

    @Option(names = {"--from"}, description = "Instructions to execute before recording", defaultValue = "0")
    private long from;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path outputFile;

    @Option(names = {"--summary"}, description = "Show only summary table")
    private boolean summaryOnly;

    @Option(names = {"--no-registers"}, description = "Omit register dumps")
    private boolean noRegisters;

    @Override
    public Integer call() {
        if (steps <= 0 || from < 0) {
            System.err.println("Invalid trace window: --steps must be positive and --from not negative");
            return RomFiles.EXIT_UNSUPPORTED;
        }
        Emulator emulator = new Emulator(EmulatorConfig.defaults());
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

        TraceRecorder recorder = new TraceRecorder(from, steps);
        while (!recorder.isComplete()) {
            recorder.step(emulator);
        }

        PrintStream out = System.out;
        try {
            if (outputFile != null) {
                out = new PrintStream(new FileOutputStream(outputFile.toFile()));
            }
            out.printf("Trace of %s: %d instructions after %,d skipped%n%n", romFile.getFileName(), steps, from);

            TracePrinter printer = new TracePrinter(out).showRegisters(!noRegisters);
            if (summaryOnly) {
                printer.printSummary(recorder.getEntries());
            } else {
                printer.printAll(recorder.getEntries());
            }
            out.println();
            out.println("State: " + emulator.getDebugState());
        } catch (IOException e) {
            System.err.println("Cannot write trace: " + e.getMessage());
            return RomFiles.EXIT_IO_ERROR;
        } finally {
            if (out != System.out) {
                out.close();
            }
        }
        return 0;
    }
}

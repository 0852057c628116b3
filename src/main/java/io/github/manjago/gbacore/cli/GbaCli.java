package io.github.manjago.gbacore.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * gbacore CLI - headless runner and diagnostics for the emulator core.
 * 
 * Usage:
 *   gbacore run game.gba [options]   - Run a ROM headless
 *   gbacore trace game.gba [options] - Instruction-by-instruction trace
 *   gbacore disasm game.gba          - Disassemble ROM words
 *   gbacore info                     - Show version and config
 */
@Command(
    name = "gbacore",
    description = "Handheld console emulator core - ARM7TDMI, bus, PPU and DMA",
    mixinStandardHelpOptions = true,
    version = "gbacore 1.0.0",
    subcommands = {
        RunCommand.class,
        TraceCommand.class,
        DisasmCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class GbaCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GbaCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}

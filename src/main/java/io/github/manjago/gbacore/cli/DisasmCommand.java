package io.github.manjago.gbacore.cli;

import io.github.manjago.gbacore.cpu.Disassembler;
import io.github.manjago.gbacore.memory.AddressMap;
import io.github.manjago.gbacore.sim.InvalidRomException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Disassemble words straight from a ROM image.
 * 
 * Examples:
 *   gbacore disasm game.gba                        # First 32 words
 *   gbacore disasm game.gba --offset 0xC0 -c 16    # 16 words from ROM offset 0xC0
 */
@Command(
    name = "disasm",
    description = "Disassemble ARM words from a ROM image",
    mixinStandardHelpOptions = true
)
public class DisasmCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "ROM file (.gba, .bin or .zip)")
    private Path romFile;

    @Option(names = {"--offset"}, description = "Byte offset into the ROM (decimal or 0x hex)", defaultValue = "0")
    private String offset;

    @Option(names = {"-c", "--count"}, description = "Words to disassemble", defaultValue = "32")
    private int count;

    @Override
    public Integer call() {
        byte[] rom;
        int start;
        try {
            rom = RomFiles.loadRom(romFile);
            start = Integer.decode(offset) & ~3;
            if (start < 0) {
                throw new NumberFormatException("offset must not be negative: " + offset);
            }
            if (count < 0) {
                throw new NumberFormatException("count must not be negative: " + count);
            }
        } catch (InvalidRomException | NumberFormatException e) {
            System.err.println("Cannot disassemble: " + e.getMessage());
            return RomFiles.EXIT_UNSUPPORTED;
        } catch (IOException e) {
            System.err.println("Cannot read file: " + e.getMessage());
            return RomFiles.EXIT_IO_ERROR;
        }

        int available = Math.max(0, (rom.length - start) / 4);
        int[] words = new int[Math.min(count, available)];
        for (int i = 0; i < words.length; i++) {
            words[i] = wordAt(rom, start + 4 * i);
        }

        System.out.println(Disassembler.disassembleWithHex(words, AddressMap.ROM_BASE + start));
        return 0;
    }

    static int wordAt(byte[] rom, int offset) {
        return (rom[offset] & 0xFF)
                | (rom[offset + 1] & 0xFF) << 8
                | (rom[offset + 2] & 0xFF) << 16
                | (rom[offset + 3] & 0xFF) << 24;
    }
}

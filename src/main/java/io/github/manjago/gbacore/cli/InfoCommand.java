package io.github.manjago.gbacore.cli;

import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.memory.AddressMap;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about gbacore.
 */
@Command(
    name = "info",
    description = "Show version, memory map and default configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║               GBACORE                 ║");
        System.out.println("║   ARM7TDMI / PPU / DMA emulator core  ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EmulatorConfig.defaults());

        System.out.println("Memory map:");
        printRegion("BIOS", AddressMap.BIOS_BASE, AddressMap.BIOS_SIZE);
        printRegion("External WRAM", AddressMap.EWRAM_BASE, AddressMap.EWRAM_SIZE);
        printRegion("Internal WRAM", AddressMap.IWRAM_BASE, AddressMap.IWRAM_SIZE);
        printRegion("IO registers", AddressMap.IO_BASE, AddressMap.IO_SIZE);
        printRegion("Palette RAM", AddressMap.PALETTE_BASE, AddressMap.PALETTE_SIZE);
        printRegion("VRAM", AddressMap.VRAM_BASE, AddressMap.VRAM_SIZE);
        printRegion("OAM", AddressMap.OAM_BASE, AddressMap.OAM_SIZE);
        printRegion("Cartridge ROM", AddressMap.ROM_BASE, AddressMap.ROM_WINDOW);
        System.out.println();

        return 0;
    }

    private static void printRegion(String name, int base, int size) {
        System.out.printf("  0x%08X-0x%08X  %-14s %,d bytes%n", base, base + size - 1, name, size);
    }
}

package io.github.manjago.gbacore.memory;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.github.manjago.gbacore.memory.AddressMap.*;

/**
 * Memory bus: owns every memory region and routes CPU accesses to them.
 * <p>
 * Each access is classified by its page (bits 24-31) into exactly one region.
 * The bus never faults: missing BIOS reads as 0, missing or exhausted ROM
 * reads as {@link #ROM_SENTINEL_32} / {@link #ROM_SENTINEL_16}, unmapped
 * addresses read as 0 and drop writes, unaligned halfword and word accesses
 * are aligned down.
 * <p>
 * 32-bit writes are always issued as two 16-bit writes (low half first) so
 * that IO observers see a single write path.
 */
public final class Bus {

    private static final Logger log = LoggerFactory.getLogger(Bus.class);

    public static final int ROM_SENTINEL_32 = 0xDEADBEEF;
    public static final int ROM_SENTINEL_16 = 0xFFFF;
    public static final int ROM_SENTINEL_8 = 0xFF;

    private final MemoryRegion bios = new MemoryRegion("BIOS", BIOS_BASE, BIOS_SIZE);
    private final MemoryRegion ewram = new MemoryRegion("EWRAM", EWRAM_BASE, EWRAM_SIZE);
    private final MemoryRegion iwram = new MemoryRegion("IWRAM", IWRAM_BASE, IWRAM_SIZE);
    private final MemoryRegion palette = new MemoryRegion("Palette", PALETTE_BASE, PALETTE_SIZE);
    private final MemoryRegion vram = new MemoryRegion("VRAM", VRAM_BASE, VRAM_SIZE);
    private final MemoryRegion oam = new MemoryRegion("OAM", OAM_BASE, OAM_SIZE);
    private final IoRegisters io = new IoRegisters();
    private final PaletteCache paletteCache = new PaletteCache();

    private final List<IoWriteObserver> observers = new ArrayList<>();

    private boolean biosLoaded;

    /** Cartridge image; empty when no ROM is loaded */
    private byte[] rom = new byte[0];

    // ========== Setup ==========

    public void addIoWriteObserver(@NotNull IoWriteObserver observer) {
        observers.add(observer);
    }

    /**
     * Install a BIOS image. Shorter images are zero-padded.
     *
     * @throws IllegalArgumentException if the image is larger than 16 KiB
     */
    public void loadBios(byte[] image) {
        if (image.length > BIOS_SIZE) {
            throw new IllegalArgumentException(
                    String.format("BIOS image is %,d bytes, at most %,d allowed", image.length, BIOS_SIZE));
        }
        bios.load(image);
        biosLoaded = image.length > 0;
        log.info("BIOS loaded ({} bytes)", image.length);
    }

    /**
     * Replace the cartridge image whole. The array is kept, not copied.
     */
    public void loadRom(byte[] image) {
        this.rom = image;
    }

    /**
     * Clear every volatile region and IO register. ROM and BIOS stay.
     */
    public void reset() {
        ewram.clear();
        iwram.clear();
        palette.clear();
        vram.clear();
        oam.clear();
        io.reset();
        paletteCache.clear();
    }

    // ========== Reads ==========

    public int read8(int address) {
        return switch (page(address)) {
            case 0x00 -> biosReadable(address) ? bios.read8(address) : 0;
            case 0x02 -> ewram.read8(ewram.offsetOf(address));
            case 0x03 -> iwram.read8(iwram.offsetOf(address));
            case 0x04 -> {
                int offset = IoRegisters.offsetOf(address);
                yield IoRegisters.contains(offset) ? io.get8(offset) : unmappedRead(address);
            }
            case 0x05 -> palette.read8(palette.offsetOf(address));
            case 0x06 -> vram.read8(vram.offsetOf(address));
            case 0x07 -> oam.read8(oam.offsetOf(address));
            case 0x08, 0x09 -> readRom(address, 1);
            default -> unmappedRead(address);
        };
    }

    public int read16(int address) {
        int aligned = address & ~1;
        return switch (page(aligned)) {
            case 0x00 -> biosReadable(aligned) ? bios.read16(aligned) : 0;
            case 0x02 -> ewram.read16(ewram.offsetOf(aligned));
            case 0x03 -> iwram.read16(iwram.offsetOf(aligned));
            case 0x04 -> {
                int offset = IoRegisters.offsetOf(aligned);
                yield IoRegisters.contains(offset) ? io.get16(offset) : unmappedRead(aligned);
            }
            case 0x05 -> palette.read16(palette.offsetOf(aligned));
            case 0x06 -> vram.read16(vram.offsetOf(aligned));
            case 0x07 -> oam.read16(oam.offsetOf(aligned));
            case 0x08, 0x09 -> readRom(aligned, 2);
            default -> unmappedRead(aligned);
        };
    }

    public int read32(int address) {
        int aligned = address & ~3;
        return switch (page(aligned)) {
            case 0x00 -> biosReadable(aligned) ? bios.read32(aligned) : 0;
            case 0x02 -> ewram.read32(ewram.offsetOf(aligned));
            case 0x03 -> iwram.read32(iwram.offsetOf(aligned));
            case 0x04 -> {
                int offset = IoRegisters.offsetOf(aligned);
                yield IoRegisters.contains(offset) ? io.get32(offset) : unmappedRead(aligned);
            }
            case 0x05 -> palette.read32(palette.offsetOf(aligned));
            case 0x06 -> vram.read32(vram.offsetOf(aligned));
            case 0x07 -> oam.read32(oam.offsetOf(aligned));
            case 0x08, 0x09 -> readRom(aligned, 4);
            default -> unmappedRead(aligned);
        };
    }

    // ========== Writes ==========

    public void write8(int address, int value) {
        switch (page(address)) {
            case 0x02 -> ewram.write8(ewram.offsetOf(address), value);
            case 0x03 -> iwram.write8(iwram.offsetOf(address), value);
            case 0x04 -> writeIo8(address, value & 0xFF);
            case 0x05 -> {
                int offset = palette.offsetOf(address);
                palette.write8(offset, value);
                syncPalette(offset);
            }
            case 0x06 -> vram.write8(vram.offsetOf(address), value);
            case 0x07 -> oam.write8(oam.offsetOf(address), value);
            default -> unmappedWrite(address);
        }
    }

    public void write16(int address, int value) {
        int aligned = address & ~1;
        switch (page(aligned)) {
            case 0x02 -> ewram.write16(ewram.offsetOf(aligned), value);
            case 0x03 -> iwram.write16(iwram.offsetOf(aligned), value);
            case 0x04 -> writeIo16(aligned, value & 0xFFFF);
            case 0x05 -> {
                int offset = palette.offsetOf(aligned);
                palette.write16(offset, value);
                syncPalette(offset);
            }
            case 0x06 -> vram.write16(vram.offsetOf(aligned), value);
            case 0x07 -> oam.write16(oam.offsetOf(aligned), value);
            default -> unmappedWrite(aligned);
        }
    }

    public void write32(int address, int value) {
        int aligned = address & ~3;
        write16(aligned, value & 0xFFFF);
        write16(aligned + 2, value >>> 16);
    }

    // ========== IO ==========

    private void writeIo16(int address, int value) {
        int offset = IoRegisters.offsetOf(address);
        if (!IoRegisters.contains(offset) || IoRegisters.isReadOnly(offset)) {
            unmappedWrite(address);
            return;
        }
        for (IoWriteObserver observer : observers) {
            observer.beforeIoWrite(address, value);
        }
        io.set16(offset, value);
        for (IoWriteObserver observer : observers) {
            observer.onIoWrite(address, value);
        }
    }

    /**
     * Byte writes are merged into their halfword so observers only ever see
     * halfword writes.
     */
    private void writeIo8(int address, int value) {
        int aligned = address & ~1;
        int offset = IoRegisters.offsetOf(aligned);
        if (!IoRegisters.contains(offset)) {
            unmappedWrite(address);
            return;
        }
        int current = io.get16(offset);
        int merged = (address & 1) == 0
                ? (current & 0xFF00) | value
                : (current & 0x00FF) | value << 8;
        writeIo16(aligned, merged);
    }

    // ========== Helpers ==========

    private boolean biosReadable(int address) {
        return biosLoaded && Integer.compareUnsigned(address, BIOS_SIZE) < 0;
    }

    private int readRom(int address, int width) {
        if (rom.length == 0) {
            return romSentinel(width);
        }
        int offset = (address - ROM_BASE) % rom.length;
        if (offset + width > rom.length) {
            return romSentinel(width);
        }
        int value = 0;
        for (int i = width - 1; i >= 0; i--) {
            value = value << 8 | (rom[offset + i] & 0xFF);
        }
        return value;
    }

    private static int romSentinel(int width) {
        return switch (width) {
            case 1 -> ROM_SENTINEL_8;
            case 2 -> ROM_SENTINEL_16;
            default -> ROM_SENTINEL_32;
        };
    }

    private void syncPalette(int offset) {
        int entry = offset & ~1;
        paletteCache.update(entry >>> 1, palette.read16(entry));
    }

    private int unmappedRead(int address) {
        if (log.isTraceEnabled()) {
            log.trace("Unmapped read at 0x{}", Integer.toHexString(address));
        }
        return 0;
    }

    private void unmappedWrite(int address) {
        if (log.isTraceEnabled()) {
            log.trace("Write to read-only or unmapped address 0x{} dropped", Integer.toHexString(address));
        }
    }

    // ========== Getters ==========

    public IoRegisters getIo() { return io; }
    public MemoryRegion getVram() { return vram; }
    public PaletteCache getPaletteCache() { return paletteCache; }
    public boolean hasBios() { return biosLoaded; }
    public boolean hasRom() { return rom.length > 0; }
    public int getRomLength() { return rom.length; }
}

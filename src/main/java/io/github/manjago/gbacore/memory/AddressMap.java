package io.github.manjago.gbacore.memory;

import org.jetbrains.annotations.Contract;

/**
 * Fixed CPU-visible address map.
 * <p>
 * <pre>
 * 0x00000000-0x00003FFF  BIOS (16 KiB, read-only, optional)
 * 0x02000000-0x0203FFFF  External WRAM (256 KiB)
 * 0x03000000-0x03007FFF  Internal WRAM (32 KiB)
 * 0x04000000-0x040003FF  IO registers (1 KiB)
 * 0x05000000-0x050003FF  Palette RAM (1 KiB)
 * 0x06000000-0x06017FFF  VRAM (96 KiB)
 * 0x07000000-0x070003FF  OAM (1 KiB)
 * 0x08000000-0x09FFFFFF  Cartridge ROM (mirrored to image length)
 * </pre>
 */
public final class AddressMap {

    private AddressMap() {
        // Constants only
    }

    public static final int BIOS_BASE = 0x0000_0000;
    public static final int BIOS_SIZE = 0x4000;

    public static final int EWRAM_BASE = 0x0200_0000;
    public static final int EWRAM_SIZE = 0x4_0000;

    public static final int IWRAM_BASE = 0x0300_0000;
    public static final int IWRAM_SIZE = 0x8000;

    public static final int IO_BASE = 0x0400_0000;
    public static final int IO_SIZE = 0x400;

    public static final int PALETTE_BASE = 0x0500_0000;
    public static final int PALETTE_SIZE = 0x400;

    public static final int VRAM_BASE = 0x0600_0000;
    public static final int VRAM_SIZE = 0x1_8000;

    public static final int OAM_BASE = 0x0700_0000;
    public static final int OAM_SIZE = 0x400;

    public static final int ROM_BASE = 0x0800_0000;
    /** ROM window spans pages 0x08 and 0x09 */
    public static final int ROM_WINDOW = 0x0200_0000;

    /** Top of the user stack the BIOS leaves behind */
    public static final int IWRAM_STACK_TOP = 0x0300_7F00;

    /**
     * Memory page (bits 24-31) an address falls in.
     */
    @Contract(pure = true)
    public static int page(int address) {
        return address >>> 24;
    }
}

package io.github.manjago.gbacore.memory;

/**
 * The 1 KiB IO register block at 0x04000000.
 * <p>
 * Registers are addressed by their offset inside the block. The accessors here
 * are the raw store: they never notify observers. CPU writes go through
 * {@link Bus}, which stores and then notifies; hardware-side updates (status
 * bits, VCOUNT, DMA enable clearing, key state) come straight here.
 */
public final class IoRegisters {

    // ========== Display ==========

    public static final int DISPCNT = 0x000;
    public static final int DISPSTAT = 0x004;
    public static final int VCOUNT = 0x006;
    public static final int BG0CNT = 0x008;
    public static final int BG1CNT = 0x00A;
    public static final int BG2CNT = 0x00C;
    public static final int BG3CNT = 0x00E;
    public static final int BG0HOFS = 0x010;
    public static final int BG0VOFS = 0x012;
    /** First offset past the display register window (blend registers end at 0x054) */
    public static final int DISPLAY_END = 0x056;

    // ========== DMA ==========

    public static final int DMA0SAD = 0x0B0;
    /** Distance between two channels' register windows */
    public static final int DMA_CHANNEL_STRIDE = 12;
    public static final int DMA3SAD = 0x0D4;
    public static final int DMA3DAD = 0x0D8;
    public static final int DMA3CNT_L = 0x0DC;
    public static final int DMA3CNT_H = 0x0DE;

    // ========== Input / system ==========

    public static final int KEYINPUT = 0x130;
    public static final int WAITCNT = 0x204;
    public static final int IME = 0x208;

    /** All ten buttons released (active-low) */
    public static final int KEYS_RELEASED = 0x03FF;

    private final MemoryRegion block = new MemoryRegion("IO", AddressMap.IO_BASE, AddressMap.IO_SIZE);

    public IoRegisters() {
        reset();
    }

    /**
     * Clear every register, then restore the power-on values.
     */
    public void reset() {
        block.clear();
        block.write16(KEYINPUT, KEYS_RELEASED);
    }

    public int get8(int offset) {
        return block.read8(offset);
    }

    public int get16(int offset) {
        return block.read16(offset);
    }

    public int get32(int offset) {
        return block.read32(offset);
    }

    public void set16(int offset, int value) {
        block.write16(offset, value & 0xFFFF);
    }

    /**
     * Offset within the block for a CPU address in the IO page.
     */
    public static int offsetOf(int address) {
        return address - AddressMap.IO_BASE;
    }

    /**
     * True for offsets inside the 1 KiB block.
     */
    public static boolean contains(int offset) {
        return offset >= 0 && offset < AddressMap.IO_SIZE;
    }

    /**
     * Registers the CPU cannot store to; KEYINPUT is owned by the host.
     */
    public static boolean isReadOnly(int offset) {
        return offset == KEYINPUT;
    }

    /**
     * Offset of BGnCNT for background {@code bg} (0-3).
     */
    public static int bgControl(int bg) {
        return BG0CNT + 2 * bg;
    }

    /**
     * Offset of BGnHOFS for background {@code bg} (0-3); BGnVOFS follows it.
     */
    public static int bgHorizontalOffset(int bg) {
        return BG0HOFS + 4 * bg;
    }
}

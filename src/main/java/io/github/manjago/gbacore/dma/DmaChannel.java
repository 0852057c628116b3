package io.github.manjago.gbacore.dma;

import io.github.manjago.gbacore.memory.IoRegisters;

/**
 * One DMA channel: where its registers live plus the values latched when it
 * was enabled.
 * <p>
 * The CPU-visible registers stay in {@link IoRegisters}; the latched copies
 * are what a running or repeating transfer actually advances.
 */
public final class DmaChannel {

    // ========== CNT_H bits ==========

    public static final int DEST_CONTROL_SHIFT = 5;
    public static final int SOURCE_CONTROL_SHIFT = 7;
    public static final int REPEAT = 1 << 9;
    public static final int WORD_UNITS = 1 << 10;
    public static final int TIMING_SHIFT = 12;
    public static final int ENABLE = 1 << 15;

    /** Units moved when the count register holds 0 */
    public static final int MAX_COUNT = 0x4000;

    /**
     * Start condition, CNT_H bits 12-13.
     */
    public enum Timing {
        IMMEDIATE, VBLANK, HBLANK, SPECIAL;

        static Timing of(int control) {
            return values()[control >>> TIMING_SHIFT & 0x3];
        }
    }

    /**
     * Pointer behaviour after each unit, CNT_H bits 5-6 (destination) or 7-8 (source).
     */
    public enum AddressControl {
        INCREMENT, DECREMENT, FIXED, INCREMENT_RELOAD;

        static AddressControl of(int control, int shift) {
            return values()[control >>> shift & 0x3];
        }

        int step(int unitSize) {
            return switch (this) {
                case INCREMENT, INCREMENT_RELOAD -> unitSize;
                case DECREMENT -> -unitSize;
                case FIXED -> 0;
            };
        }
    }

    private final int index;
    private final int baseOffset;
    private final int countMask;

    private boolean armed;
    private int control;
    private int source;
    private int destination;
    private int count;

    public DmaChannel(int index) {
        this.index = index;
        this.baseOffset = IoRegisters.DMA0SAD + IoRegisters.DMA_CHANNEL_STRIDE * index;
        // Channel 3 has a 16-bit count, the others 14 bits
        this.countMask = index == 3 ? 0xFFFF : 0x3FFF;
    }

    /**
     * Latch the register values; the channel then waits for its start condition.
     */
    void arm(int control, int source, int destination, int rawCount) {
        this.armed = true;
        this.control = control;
        this.source = source;
        this.destination = destination;
        this.count = unitsFor(rawCount);
    }

    void disarm() {
        armed = false;
    }

    /**
     * Units a raw count register value stands for; 0 means {@link #MAX_COUNT}.
     */
    int unitsFor(int rawCount) {
        int masked = rawCount & countMask;
        return masked == 0 ? MAX_COUNT : masked;
    }

    // ========== Register offsets ==========

    public int sourceOffset() { return baseOffset; }
    public int destinationOffset() { return baseOffset + 4; }
    public int countOffset() { return baseOffset + 8; }
    public int controlOffset() { return baseOffset + 10; }

    // ========== Latched state ==========

    public int getIndex() { return index; }
    public boolean isArmed() { return armed; }
    public int getControl() { return control; }
    public int getSource() { return source; }
    public int getDestination() { return destination; }
    public int getCount() { return count; }

    void setControl(int control) { this.control = control; }
    void setSource(int source) { this.source = source; }
    void setDestination(int destination) { this.destination = destination; }
    void setCount(int count) { this.count = count; }

    public Timing timing() { return Timing.of(control); }
    public boolean isRepeat() { return (control & REPEAT) != 0; }
    public int unitSize() { return (control & WORD_UNITS) != 0 ? 4 : 2; }
    public AddressControl sourceControl() { return AddressControl.of(control, SOURCE_CONTROL_SHIFT); }
    public AddressControl destinationControl() { return AddressControl.of(control, DEST_CONTROL_SHIFT); }

    @Override
    public String toString() {
        return String.format("DMA%d[%s src=0x%08X dst=0x%08X count=%d %s]",
                index, armed ? "armed" : "idle", source, destination, count, timing());
    }
}

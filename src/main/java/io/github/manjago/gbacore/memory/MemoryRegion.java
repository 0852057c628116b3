package io.github.manjago.gbacore.memory;

import java.util.Arrays;

/**
 * Named fixed-capacity byte buffer mapped at a base address.
 * <p>
 * One owned byte array per region; halfword and word accessors encode and
 * decode little-endian explicitly. Every access wraps:
 * {@code offset = (address - base) mod capacity}.
 */
public final class MemoryRegion {

    private final String name;
    private final int base;
    private final byte[] data;

    public MemoryRegion(String name, int base, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Region " + name + " needs a positive capacity: " + capacity);
        }
        this.name = name;
        this.base = base;
        this.data = new byte[capacity];
    }

    /**
     * Offset inside the region for a CPU address, after wrapping.
     */
    public int offsetOf(int address) {
        return Integer.remainderUnsigned(address - base, data.length);
    }

    // ========== Offset-based access ==========

    public int read8(int offset) {
        return data[wrap(offset)] & 0xFF;
    }

    public int read16(int offset) {
        int o = wrap(offset & ~1);
        return (data[o] & 0xFF) | (data[wrap(o + 1)] & 0xFF) << 8;
    }

    public int read32(int offset) {
        int o = wrap(offset & ~3);
        return (data[o] & 0xFF)
                | (data[wrap(o + 1)] & 0xFF) << 8
                | (data[wrap(o + 2)] & 0xFF) << 16
                | (data[wrap(o + 3)] & 0xFF) << 24;
    }

    public void write8(int offset, int value) {
        data[wrap(offset)] = (byte) value;
    }

    public void write16(int offset, int value) {
        int o = wrap(offset & ~1);
        data[o] = (byte) value;
        data[wrap(o + 1)] = (byte) (value >>> 8);
    }

    public void write32(int offset, int value) {
        int o = wrap(offset & ~3);
        data[o] = (byte) value;
        data[wrap(o + 1)] = (byte) (value >>> 8);
        data[wrap(o + 2)] = (byte) (value >>> 16);
        data[wrap(o + 3)] = (byte) (value >>> 24);
    }

    // ========== Bulk ==========

    /**
     * Copy {@code source} into the start of the region. Bytes past the
     * capacity are ignored; the rest of the region is zeroed.
     */
    public void load(byte[] source) {
        clear();
        System.arraycopy(source, 0, data, 0, Math.min(source.length, data.length));
    }

    public void clear() {
        Arrays.fill(data, (byte) 0);
    }

    private int wrap(int offset) {
        return Integer.remainderUnsigned(offset, data.length);
    }

    // ========== Getters ==========

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return data.length;
    }

    @Override
    public String toString() {
        return String.format("MemoryRegion{%s @ 0x%08X, %d bytes}", name, base, data.length);
    }
}

package io.github.manjago.gbacore.memory;

import org.jetbrains.annotations.Contract;

import java.util.Arrays;

/**
 * RGB888 expansion of the 512 palette RAM entries.
 * <p>
 * Kept in sync by the bus on every palette write, so that
 * {@code get(i) == expand(palette[i])} holds at all times.
 */
public final class PaletteCache {

    public static final int ENTRIES = 512;

    private final int[] rgb = new int[ENTRIES];

    /**
     * RGB888 color of palette entry {@code index}, packed as 0xRRGGBB.
     */
    public int get(int index) {
        return rgb[index & (ENTRIES - 1)];
    }

    /**
     * Refresh entry {@code index} from its BGR-555 value.
     */
    public void update(int index, int bgr555) {
        rgb[index & (ENTRIES - 1)] = expand(bgr555);
    }

    public void clear() {
        Arrays.fill(rgb, 0);
    }

    /**
     * Expand a BGR-555 color to 0xRRGGBB, each channel {@code (c5 << 3) | (c5 >> 2)}.
     */
    @Contract(pure = true)
    public static int expand(int bgr555) {
        int r5 = bgr555 & 0x1F;
        int g5 = (bgr555 >>> 5) & 0x1F;
        int b5 = (bgr555 >>> 10) & 0x1F;
        return widen(r5) << 16 | widen(g5) << 8 | widen(b5);
    }

    private static int widen(int c5) {
        return (c5 << 3) | (c5 >>> 2);
    }
}

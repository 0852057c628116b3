package io.github.manjago.gbacore.video;

/**
 * Scanline timing of the display.
 *
 * @param cyclesPerScanline CPU cycles one full line takes (draw + H-blank)
 * @param hdrawCycles cycles of the visible part; the rest of the line is H-blank
 */
public record DisplayTiming(int cyclesPerScanline, int hdrawCycles) {

    /** Hardware values: 1232 cycles per line, 960 of them drawing */
    public static final DisplayTiming STANDARD = new DisplayTiming(1232, 960);

    public DisplayTiming {
        if (hdrawCycles <= 0 || hdrawCycles >= cyclesPerScanline) {
            throw new IllegalArgumentException(String.format(
                    "Need 0 < hdrawCycles < cyclesPerScanline, got %d / %d", hdrawCycles, cyclesPerScanline));
        }
    }

    public int hblankCycles() {
        return cyclesPerScanline - hdrawCycles;
    }

    /**
     * Cycles of one complete frame, V-blank included.
     */
    public long cyclesPerFrame() {
        return (long) cyclesPerScanline * Ppu.TOTAL_LINES;
    }
}

package io.github.manjago.gbacore.video;

import io.github.manjago.gbacore.memory.Bus;
import io.github.manjago.gbacore.memory.IoRegisters;
import io.github.manjago.gbacore.memory.IoWriteObserver;
import io.github.manjago.gbacore.memory.MemoryRegion;
import io.github.manjago.gbacore.memory.PaletteCache;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.github.manjago.gbacore.memory.IoRegisters.*;

/**
 * Picture-processing unit: display timing plus deferred scanline rendering.
 * <p>
 * Timing: every scanline lasts {@link DisplayTiming#cyclesPerScanline()} cycles,
 * the last {@link DisplayTiming#hblankCycles()} of them are H-blank. Lines 160-227
 * are V-blank; after line 227 the beam wraps to line 0.
 * <p>
 * Rendering is deferred: lines are drawn into the {@link FrameBuffer} only when
 * the render queue is flushed, which happens on entering V-blank and just
 * before any write to a display register. Lines already scanned out therefore
 * keep the register values they were displayed with.
 */
public final class Ppu implements IoWriteObserver {

    private static final Logger log = LoggerFactory.getLogger(Ppu.class);

    public static final int VISIBLE_LINES = FrameBuffer.HEIGHT;
    public static final int TOTAL_LINES = 228;

    // ========== DISPSTAT bits ==========

    public static final int STAT_VBLANK = 1;
    public static final int STAT_HBLANK = 1 << 1;
    public static final int STAT_VCOUNT_MATCH = 1 << 2;
    private static final int STAT_READ_ONLY = STAT_VBLANK | STAT_HBLANK | STAT_VCOUNT_MATCH;

    // ========== DISPCNT bits ==========

    private static final int MODE_MASK = 0x7;
    private static final int FRAME_SELECT = 1 << 4;
    public static final int FORCED_BLANK = 1 << 7;
    private static final int BG0_ENABLE = 1 << 8;

    /** Second bitmap page in modes 4 and 5 */
    private static final int PAGE_OFFSET = 0xA000;

    private static final int MODE5_WIDTH = 160;
    private static final int MODE5_HEIGHT = 128;

    private final IoRegisters io;
    private final MemoryRegion vram;
    private final PaletteCache palette;

    private final int cyclesPerScanline;
    private final int hblankCycles;

    private final FrameBuffer frameBuffer = new FrameBuffer();
    private final List<DisplayEventListener> listeners = new ArrayList<>();

    private int currentScanline;

    /** Cycles until the current scanline ends */
    private int cyclesLeftInLine;

    /** Last line flushed to the frame buffer; -1 when none of this frame is */
    private int lastRenderedLine;

    private boolean inHBlank;

    /** V-blanks entered since reset */
    private long frameCount;

    public Ppu(Bus bus) {
        this(bus, DisplayTiming.STANDARD);
    }

    public Ppu(Bus bus, DisplayTiming timing) {
        this.io = bus.getIo();
        this.vram = bus.getVram();
        this.palette = bus.getPaletteCache();
        this.cyclesPerScanline = timing.cyclesPerScanline();
        this.hblankCycles = timing.hblankCycles();
        reset();
    }

    public void addDisplayEventListener(@NotNull DisplayEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Back to the top of line 0 with an empty render queue.
     */
    public void reset() {
        currentScanline = 0;
        cyclesLeftInLine = cyclesPerScanline;
        lastRenderedLine = -1;
        inHBlank = false;
        frameCount = 0;
        frameBuffer.clear();
        io.set16(VCOUNT, 0);
        updateStatus();
    }

    // ========== Timing ==========

    /**
     * Move the beam forward by {@code cycles}. Never throws.
     */
    public void advance(int cycles) {
        try {
            cyclesLeftInLine -= cycles;
            while (cyclesLeftInLine <= 0) {
                enterHBlank();
                cyclesLeftInLine += cyclesPerScanline;
                nextLine();
            }
            if (cyclesLeftInLine <= hblankCycles) {
                enterHBlank();
            }
            updateStatus();
        } catch (RuntimeException e) {
            log.warn("Display step failed on scanline {}", currentScanline, e);
        }
    }

    private void enterHBlank() {
        if (inHBlank) {
            return;
        }
        inHBlank = true;
        for (DisplayEventListener listener : listeners) {
            listener.onHBlank(currentScanline);
        }
    }

    private void nextLine() {
        inHBlank = false;
        currentScanline++;
        if (currentScanline == TOTAL_LINES) {
            currentScanline = 0;
            // Lines 161-227 are never visible; start the new frame's queue
            lastRenderedLine = -1;
        }
        io.set16(VCOUNT, currentScanline);

        if (currentScanline == VISIBLE_LINES) {
            flushRenderQueue();
            frameCount++;
            for (DisplayEventListener listener : listeners) {
                listener.onVBlank(frameCount);
            }
        }
    }

    /**
     * Recompute the DISPSTAT status bits from the beam position.
     */
    private void updateStatus() {
        int stat = io.get16(DISPSTAT) & ~STAT_READ_ONLY;
        if (currentScanline >= VISIBLE_LINES) {
            stat |= STAT_VBLANK;
        }
        if (inHBlank) {
            stat |= STAT_HBLANK;
        }
        if (currentScanline == (stat >>> 8 & 0xFF)) {
            stat |= STAT_VCOUNT_MATCH;
        }
        io.set16(DISPSTAT, stat);
    }

    // ========== IO observer ==========

    @Override
    public void beforeIoWrite(int address, int value) {
        int offset = IoRegisters.offsetOf(address);
        if (isDisplayRegister(offset) && io.get16(offset) != value) {
            flushRenderQueue();
        }
    }

    @Override
    public void onIoWrite(int address, int value) {
        int offset = IoRegisters.offsetOf(address);
        if (offset == VCOUNT) {
            io.set16(VCOUNT, currentScanline);
        } else if (offset == DISPSTAT) {
            updateStatus();
        }
    }

    /**
     * Registers whose value changes what gets drawn.
     */
    static boolean isDisplayRegister(int offset) {
        return offset >= DISPCNT && offset < DISPLAY_END && offset != DISPSTAT && offset != VCOUNT;
    }

    // ========== Rendering ==========

    /**
     * Render every visible line after {@code lastRenderedLine} up to and
     * including the current scanline.
     */
    public void flushRenderQueue() {
        int line = lastRenderedLine;
        while (line != currentScanline) {
            line = (line + 1) % TOTAL_LINES;
            if (line < VISIBLE_LINES) {
                renderScanLine(line);
            }
        }
        lastRenderedLine = currentScanline;
    }

    /**
     * Draw one visible line with the current register and memory contents.
     * Lines outside 0-159 are ignored.
     */
    public void renderScanLine(int line) {
        if (line < 0 || line >= VISIBLE_LINES) {
            return;
        }
        int dispcnt = io.get16(DISPCNT);
        frameBuffer.fillLine(line, palette.get(0));
        if ((dispcnt & FORCED_BLANK) != 0) {
            return;
        }
        switch (dispcnt & MODE_MASK) {
            case 0 -> renderTextLayers(line, dispcnt, 0b1111);
            case 1 -> renderTextLayers(line, dispcnt, 0b0011);
            case 3 -> renderBitmap15(line);
            case 4 -> renderBitmap8(line, dispcnt);
            case 5 -> renderSmallBitmap15(line, dispcnt);
            default -> {
                // Affine modes are not modelled: backdrop only
            }
        }
    }

    /**
     * Text backgrounds, lowest priority first; within a priority BG3 before BG0.
     */
    private void renderTextLayers(int line, int dispcnt, int layerMask) {
        for (int priority = 3; priority >= 0; priority--) {
            for (int bg = 3; bg >= 0; bg--) {
                boolean enabled = (dispcnt & (BG0_ENABLE << bg)) != 0 && (layerMask & (1 << bg)) != 0;
                if (enabled && (io.get16(bgControl(bg)) & 0x3) == priority) {
                    renderTextBackground(bg, line);
                }
            }
        }
    }

    private void renderTextBackground(int bg, int line) {
        int control = io.get16(bgControl(bg));
        int charBase = ((control >>> 2) & 0x3) * 0x4000;
        int screenBase = ((control >>> 8) & 0x1F) * 0x800;
        boolean eightBpp = (control & 0x80) != 0;
        int size = control >>> 14 & 0x3;
        int mapWidth = (size & 1) != 0 ? 512 : 256;
        int mapHeight = (size & 2) != 0 ? 512 : 256;

        int scrollX = io.get16(bgHorizontalOffset(bg)) & 0x1FF;
        int scrollY = io.get16(bgHorizontalOffset(bg) + 2) & 0x1FF;

        int y = (line + scrollY) & (mapHeight - 1);
        int tileRow = y >>> 3;
        int fineY = y & 7;

        for (int x = 0; x < FrameBuffer.WIDTH; x++) {
            int mapX = (x + scrollX) & (mapWidth - 1);
            int entry = screenEntry(screenBase, mapX >>> 3, tileRow, mapWidth);

            int tileId = entry & 0x3FF;
            int px = (entry & 0x400) != 0 ? 7 - (mapX & 7) : mapX & 7;
            int py = (entry & 0x800) != 0 ? 7 - fineY : fineY;

            int colorIndex;
            if (eightBpp) {
                colorIndex = vram.read8(charBase + tileId * 64 + py * 8 + px);
                if (colorIndex == 0) {
                    continue;
                }
            } else {
                int pair = vram.read8(charBase + tileId * 32 + py * 4 + (px >>> 1));
                int index = (px & 1) == 0 ? pair & 0x0F : pair >>> 4;
                if (index == 0) {
                    continue;
                }
                colorIndex = (entry >>> 12) * 16 + index;
            }
            frameBuffer.setRgb(x, line, palette.get(colorIndex));
        }
    }

    /**
     * Tile-map entry for tile (column, row); maps wider or taller than 256
     * pixels are laid out as consecutive 32x32 screen blocks.
     */
    private int screenEntry(int screenBase, int column, int row, int mapWidth) {
        int block = (column >>> 5) + (row >>> 5) * (mapWidth / 256);
        int offset = screenBase + block * 0x800 + ((row & 31) * 32 + (column & 31)) * 2;
        return vram.read16(offset);
    }

    /**
     * Mode 3: 240x160 direct BGR-555.
     */
    private void renderBitmap15(int line) {
        for (int x = 0; x < FrameBuffer.WIDTH; x++) {
            int color = vram.read16((line * FrameBuffer.WIDTH + x) * 2);
            frameBuffer.setRgb(x, line, PaletteCache.expand(color));
        }
    }

    /**
     * Mode 4: 240x160 palette indices, two pages.
     */
    private void renderBitmap8(int line, int dispcnt) {
        int base = (dispcnt & FRAME_SELECT) != 0 ? PAGE_OFFSET : 0;
        for (int x = 0; x < FrameBuffer.WIDTH; x++) {
            int index = vram.read8(base + line * FrameBuffer.WIDTH + x);
            if (index != 0) {
                frameBuffer.setRgb(x, line, palette.get(index));
            }
        }
    }

    /**
     * Mode 5: 160x128 direct BGR-555, two pages; the rest shows the backdrop.
     */
    private void renderSmallBitmap15(int line, int dispcnt) {
        if (line >= MODE5_HEIGHT) {
            return;
        }
        int base = (dispcnt & FRAME_SELECT) != 0 ? PAGE_OFFSET : 0;
        for (int x = 0; x < MODE5_WIDTH; x++) {
            int color = vram.read16(base + (line * MODE5_WIDTH + x) * 2);
            frameBuffer.setRgb(x, line, PaletteCache.expand(color));
        }
    }

    // ========== Getters ==========

    public int getCurrentScanline() { return currentScanline; }
    public int getLastRenderedLine() { return lastRenderedLine; }
    public long getFrameCount() { return frameCount; }
    public boolean isInVBlank() { return currentScanline >= VISIBLE_LINES; }
    public boolean isInHBlank() { return inHBlank; }
    public FrameBuffer getFrameBuffer() { return frameBuffer; }
    public int getCyclesPerScanline() { return cyclesPerScanline; }
}

package io.github.manjago.gbacore.video;

import java.util.Arrays;

/**
 * 240x160 RGBA8888 pixel buffer, always fully opaque.
 * <p>
 * Bytes are stored R, G, B, A per pixel, row-major. The PPU writes into it;
 * display sinks borrow it for one frame and copy what they keep.
 */
public final class FrameBuffer {

    public static final int WIDTH = 240;
    public static final int HEIGHT = 160;

    private static final int BYTES_PER_PIXEL = 4;

    private final byte[] rgba = new byte[WIDTH * HEIGHT * BYTES_PER_PIXEL];

    public FrameBuffer() {
        clear();
    }

    /**
     * Set pixel (x, y) from a 0xRRGGBB color.
     */
    public void setRgb(int x, int y, int rgb) {
        int i = (y * WIDTH + x) * BYTES_PER_PIXEL;
        rgba[i] = (byte) (rgb >>> 16);
        rgba[i + 1] = (byte) (rgb >>> 8);
        rgba[i + 2] = (byte) rgb;
        rgba[i + 3] = (byte) 0xFF;
    }

    /**
     * Fill one line with a 0xRRGGBB color.
     */
    public void fillLine(int y, int rgb) {
        for (int x = 0; x < WIDTH; x++) {
            setRgb(x, y, rgb);
        }
    }

    /**
     * Color of pixel (x, y) as 0xRRGGBB.
     */
    public int getRgb(int x, int y) {
        int i = (y * WIDTH + x) * BYTES_PER_PIXEL;
        return (rgba[i] & 0xFF) << 16 | (rgba[i + 1] & 0xFF) << 8 | rgba[i + 2] & 0xFF;
    }

    /**
     * Alpha of pixel (x, y); always 0xFF.
     */
    public int getAlpha(int x, int y) {
        return rgba[(y * WIDTH + x) * BYTES_PER_PIXEL + 3] & 0xFF;
    }

    /**
     * Independent copy of the RGBA bytes.
     */
    public byte[] copyRgba() {
        return rgba.clone();
    }

    /**
     * Pixels packed as 0xAARRGGBB, the layout {@code BufferedImage.TYPE_INT_ARGB} expects.
     */
    public int[] toArgb() {
        int[] argb = new int[WIDTH * HEIGHT];
        for (int p = 0; p < argb.length; p++) {
            int i = p * BYTES_PER_PIXEL;
            argb[p] = (rgba[i + 3] & 0xFF) << 24
                    | (rgba[i] & 0xFF) << 16
                    | (rgba[i + 1] & 0xFF) << 8
                    | rgba[i + 2] & 0xFF;
        }
        return argb;
    }

    /**
     * Reset to opaque black.
     */
    public void clear() {
        Arrays.fill(rgba, (byte) 0);
        for (int i = 3; i < rgba.length; i += BYTES_PER_PIXEL) {
            rgba[i] = (byte) 0xFF;
        }
    }
}

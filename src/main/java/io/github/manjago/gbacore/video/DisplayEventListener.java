package io.github.manjago.gbacore.video;

/**
 * Blanking events raised by the {@link Ppu} as the beam moves.
 */
public interface DisplayEventListener {

    /**
     * Called when scanline 160 is entered.
     *
     * @param frame number of V-blanks so far, this one included
     */
    default void onVBlank(long frame) {}

    /**
     * Called when the H-blank part of a scanline begins.
     *
     * @param scanline line whose H-blank starts (0-227)
     */
    default void onHBlank(int scanline) {}
}

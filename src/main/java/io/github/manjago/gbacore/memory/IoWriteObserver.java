package io.github.manjago.gbacore.memory;

/**
 * Reacts to CPU writes into the IO register block.
 * <p>
 * The {@link Bus} holds observers by reference and calls them for every
 * halfword it stores in the IO block (32-bit writes arrive as two calls, low
 * half first). Implemented by the PPU and the DMA controller.
 */
public interface IoWriteObserver {

    /**
     * Called before the value is stored.
     *
     * @param address CPU address of the halfword (aligned)
     * @param value halfword about to be written
     */
    default void beforeIoWrite(int address, int value) {}

    /**
     * Called after the value is stored, before the bus write returns.
     *
     * @param address CPU address of the halfword (aligned)
     * @param value halfword that was written
     */
    void onIoWrite(int address, int value);
}

package io.github.manjago.gbacore.sim;

/**
 * Listener for host-loop events.
 * 
 * Implement this interface to react to emulation progress,
 * for example to print status or stop after a condition.
 */
public interface EmulatorListener {

    /**
     * Called after every host frame, once the picture was presented.
     * 
     * @param frame host frames run so far, this one included
     * @param instructions instructions executed during this frame
     */
    default void onFrame(long frame, int instructions) {}

    /**
     * Called periodically with progress statistics.
     * 
     * @param stats current statistics
     */
    default void onProgress(EmulatorStats stats) {}

    /**
     * No-op listener that does nothing.
     */
    EmulatorListener NOOP = new EmulatorListener() {};
}

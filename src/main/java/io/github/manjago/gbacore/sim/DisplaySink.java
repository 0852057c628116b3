package io.github.manjago.gbacore.sim;

import io.github.manjago.gbacore.video.FrameBuffer;

/**
 * Receives the finished picture once per host frame.
 */
@FunctionalInterface
public interface DisplaySink {

    /**
     * Show a frame. The buffer is only borrowed: it belongs to the emulator
     * and changes after this call returns, so copy whatever must be kept.
     */
    void present(FrameBuffer frame);

    /**
     * Sink that ignores every frame (headless runs).
     */
    DisplaySink NONE = frame -> {};
}

package io.github.manjago.gbacore.sim;

/**
 * Snapshot of emulation statistics.
 */
public record EmulatorStats(
    long hostFrames,
    long videoFrames,          // V-blanks entered
    long instructions,
    long unimplemented,        // no-op instructions (unsupported encodings included)
    long cycles,
    long budgetCutFrames,      // host frames ended by the instruction cap, not the cycle budget
    long dmaTransfers,
    int romSize,
    long elapsedMillis
) {

    /**
     * Average instructions per host frame.
     */
    public double instructionsPerFrame() {
        return hostFrames > 0 ? (double) instructions / hostFrames : 0;
    }

    /**
     * Host frames per wall-clock second.
     */
    public double framesPerSecond() {
        return elapsedMillis > 0 ? hostFrames * 1000.0 / elapsedMillis : 0;
    }

    /**
     * Share of executed instructions that were no-ops, in percent.
     */
    public double unimplementedPercent() {
        return instructions > 0 ? 100.0 * unimplemented / instructions : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Emulation Statistics ===
            Host frames:      %,d (%.1f fps)
            Video frames:     %,d
            Instructions:     %,d (%.0f per frame)
              Unimplemented:  %,d (%.2f%%)
            Cycles:           %,d
            Budget-cut frames: %,d
            DMA transfers:    %,d
            ROM size:         %,d bytes
            """,
            hostFrames, framesPerSecond(),
            videoFrames,
            instructions, instructionsPerFrame(),
            unimplemented, unimplementedPercent(),
            cycles,
            budgetCutFrames,
            dmaTransfers,
            romSize
        );
    }
}

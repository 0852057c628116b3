package io.github.manjago.gbacore.debug;

import io.github.manjago.gbacore.cpu.CpuState;
import io.github.manjago.gbacore.cpu.Disassembler;
import io.github.manjago.gbacore.memory.IoRegisters;
import io.github.manjago.gbacore.sim.Emulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Steps an emulator one instruction at a time and records what ran.
 * 
 * Usage:
 * <pre>
 * TraceRecorder recorder = new TraceRecorder(1000, 50); // skip 1000, keep 50
 * while (!recorder.isComplete()) {
 *     recorder.step(emulator);
 * }
 * List&lt;TraceEntry&gt; entries = recorder.getEntries();
 * </pre>
 */
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private final List<TraceEntry> entries = new ArrayList<>();
    private final long skip;
    private final int maxEntries;

    private long steps = 0;

    /**
     * @param skip instructions to execute before recording starts
     * @param maxEntries instructions to record
     */
    public TraceRecorder(long skip, int maxEntries) {
        if (skip < 0 || maxEntries <= 0) {
            throw new IllegalArgumentException(
                    "Need skip >= 0 and maxEntries > 0, got " + skip + " / " + maxEntries);
        }
        this.skip = skip;
        this.maxEntries = maxEntries;
    }

    /**
     * Execute one instruction, recording it once past the skipped prefix.
     */
    public void step(Emulator emulator) {
        CpuState state = emulator.getCpu().getState();
        int address = state.getInstructionAddress();
        int word = emulator.getBus().read32(address);
        long unimplementedBefore = state.getUnimplemented();

        emulator.stepInstruction();

        long index = steps++;
        if (index < skip || isComplete()) {
            return;
        }

        entries.add(new TraceEntry(
            index - skip,
            address,
            word,
            Disassembler.disassemble(word, address),
            state.snapshotRegisters(),
            state.getCpsr(),
            emulator.getBus().getIo().get16(IoRegisters.VCOUNT),
            state.getUnimplemented() > unimplementedBefore
        ));

        if (entries.size() % 100 == 0) {
            log.debug("Recorded {} trace entries", entries.size());
        }
    }

    /**
     * Check if recording is complete.
     */
    public boolean isComplete() {
        return entries.size() >= maxEntries;
    }

    /**
     * Get recorded entries.
     */
    public List<TraceEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Instructions executed so far, skipped ones included.
     */
    public long getSteps() {
        return steps;
    }

    /**
     * Clear all recorded entries.
     */
    public void clear() {
        entries.clear();
        steps = 0;
    }
}

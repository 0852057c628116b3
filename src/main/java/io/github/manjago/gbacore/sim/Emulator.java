package io.github.manjago.gbacore.sim;

import io.github.manjago.gbacore.config.EmulatorConfig;
import io.github.manjago.gbacore.cpu.CpuCore;
import io.github.manjago.gbacore.cpu.CpuState;
import io.github.manjago.gbacore.dma.DmaController;
import io.github.manjago.gbacore.memory.AddressMap;
import io.github.manjago.gbacore.memory.Bus;
import io.github.manjago.gbacore.memory.IoRegisters;
import io.github.manjago.gbacore.video.Ppu;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One emulated console and the host loop that drives it.
 * <p>
 * Owns the Bus, CPU, PPU and DMA controller. A host frame ({@link #runFrame()})
 * alternates CPU steps with PPU advances until the cycle budget or the
 * instruction cap is reached, so control always returns to the host whatever
 * the ROM does. {@link #run(long)} repeats that with optional real-time pacing
 * and can be stopped, paused and resumed from another thread.
 */
public class Emulator {

    private static final Logger log = LoggerFactory.getLogger(Emulator.class);

    private final EmulatorConfig config;

    // Core components
    private final Bus bus;
    private final CpuCore cpu;
    private final Ppu ppu;
    private final DmaController dma;

    // Statistics since the last load
    private long hostFrames = 0;
    private long totalCycles = 0;
    private long budgetCutFrames = 0;
    private long runMillis = 0;

    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private EmulatorListener listener = EmulatorListener.NOOP;
    private DisplaySink displaySink = DisplaySink.NONE;

    public Emulator(EmulatorConfig config) {
        this.config = config;
        this.bus = new Bus();
        this.cpu = new CpuCore(bus, config.cyclesPerInstruction());
        this.ppu = new Ppu(bus, config.displayTiming());
        this.dma = new DmaController(bus);

        // PPU first: a display register write flushes before DMA can copy anything
        bus.addIoWriteObserver(ppu);
        bus.addIoWriteObserver(dma);
        ppu.addDisplayEventListener(dma);

        log.debug("Emulator created: {}", config);
    }

    public void setListener(EmulatorListener listener) {
        this.listener = listener != null ? listener : EmulatorListener.NOOP;
    }

    public void setDisplaySink(DisplaySink sink) {
        this.displaySink = sink != null ? sink : DisplaySink.NONE;
    }

    // ========== Loading ==========

    /**
     * Load a cartridge image and restart the machine.
     *
     * @throws InvalidRomException if the image is empty; nothing is changed then
     */
    public void loadRom(byte[] image) {
        if (image == null || image.length == 0) {
            throw new InvalidRomException("ROM image is empty");
        }
        bus.loadRom(image.clone());
        reset();
        log.info("ROM loaded ({} bytes), entry 0x{}", image.length,
                Integer.toHexString(cpu.getState().getInstructionAddress()));
    }

    /**
     * Install a BIOS image. Takes effect at the next {@link #loadRom} or {@link #reset}.
     */
    public void loadBios(byte[] image) {
        bus.loadBios(image);
    }

    /**
     * Clear volatile memory and restart every component from power-on state.
     */
    public void reset() {
        bus.reset();
        ppu.reset();
        dma.reset();

        if (bus.hasBios()) {
            cpu.reset(AddressMap.BIOS_BASE);
        } else if (config.skipBios()) {
            cpu.reset(AddressMap.ROM_BASE);
            cpu.getState().setRegister(CpuState.SP, AddressMap.IWRAM_STACK_TOP);
        } else {
            log.warn("No BIOS image and boot.skip-bios is off, starting at 0x0 anyway");
            cpu.reset(AddressMap.BIOS_BASE);
        }

        hostFrames = 0;
        totalCycles = 0;
        budgetCutFrames = 0;
        runMillis = 0;
    }

    /**
     * Store the active-low button mask (bit set = released) into KEYINPUT.
     */
    public void setKeyState(int mask) {
        bus.getIo().set16(IoRegisters.KEYINPUT, mask & IoRegisters.KEYS_RELEASED);
    }

    // ========== Stepping ==========

    /**
     * Execute one instruction and advance the display by the cycles it took.
     *
     * @return cycles consumed
     */
    public int stepInstruction() {
        int cycles = cpu.step();
        ppu.advance(cycles);
        totalCycles += cycles;
        return cycles;
    }

    /**
     * Run one host frame and present the picture.
     *
     * @return instructions executed during the frame
     */
    public int runFrame() {
        long cycles = 0;
        int instructions = 0;
        while (cycles < config.cyclesPerFrame() && instructions < config.maxInstructionsPerFrame()) {
            cycles += stepInstruction();
            instructions++;
        }
        if (cycles < config.cyclesPerFrame()) {
            budgetCutFrames++;
        }
        hostFrames++;

        ppu.flushRenderQueue();
        displaySink.present(ppu.getFrameBuffer());
        listener.onFrame(hostFrames, instructions);
        return instructions;
    }

    /**
     * Run host frames until {@code frames} are done or {@link #stop()} is called.
     * With a positive {@code frame.rate} frames are paced to wall-clock time.
     *
     * @param frames number of frames to run (0 = until stopped)
     */
    public void run(long frames) {
        boolean infinite = frames <= 0;

        if (running.getAndSet(true)) {
            log.warn("Emulator already running");
            return;
        }

        stopRequested.set(false);
        log.info("Starting emulation{}", infinite ? " (until stopped)" : String.format(" for %,d frames", frames));

        long startTime = System.currentTimeMillis();
        long frameNanos = config.frameRate() > 0 ? TimeUnit.SECONDS.toNanos(1) / config.frameRate() : 0;
        long nextFrameAt = System.nanoTime();
        long framesDone = 0;

        try {
            while (!stopRequested.get()) {
                if (!infinite && framesDone >= frames) {
                    break;
                }
                if (paused.get()) {
                    sleepNanos(TimeUnit.MILLISECONDS.toNanos(10));
                    nextFrameAt = System.nanoTime();
                    continue;
                }

                runFrame();
                framesDone++;

                if (hostFrames % config.reportInterval() == 0) {
                    reportProgress();
                }

                if (frameNanos > 0) {
                    nextFrameAt += frameNanos;
                    sleepNanos(nextFrameAt - System.nanoTime());
                }
            }
        } finally {
            running.set(false);
            long elapsed = System.currentTimeMillis() - startTime;
            runMillis += elapsed;
            log.info("Emulation stopped after {} frames ({} ms, {} frames/sec)",
                    framesDone, elapsed, framesDone * 1000 / Math.max(1, elapsed));
        }
    }

    private void sleepNanos(long nanos) {
        if (nanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        }
    }

    /**
     * Request graceful stop after the current frame.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    public void pause() {
        if (!paused.getAndSet(true)) {
            log.info("Paused at frame {}", hostFrames);
        }
    }

    public void resume() {
        if (paused.getAndSet(false)) {
            log.info("Resumed at frame {}", hostFrames);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isPaused() {
        return paused.get();
    }

    private void reportProgress() {
        log.info("Frame {}: PC=0x{}, {} instructions, {} unimplemented",
                hostFrames, Integer.toHexString(cpu.getState().getInstructionAddress()),
                cpu.getState().getExecuted(), cpu.getState().getUnimplemented());

        listener.onProgress(getStats());
    }

    // ========== Getters ==========

    public EmulatorConfig getConfig() { return config; }
    public Bus getBus() { return bus; }
    public CpuCore getCpu() { return cpu; }
    public Ppu getPpu() { return ppu; }
    public DmaController getDma() { return dma; }
    public long getHostFrames() { return hostFrames; }
    public long getTotalCycles() { return totalCycles; }

    /**
     * Registers and counters for diagnostics.
     */
    public DebugState getDebugState() {
        CpuState state = cpu.getState();
        return new DebugState(
            state.getInstructionAddress(),
            state.getCpsr(),
            bus.getIo().get16(IoRegisters.VCOUNT),
            ppu.getFrameCount(),
            state.getExecuted()
        );
    }

    /**
     * Get current emulation statistics.
     */
    public EmulatorStats getStats() {
        CpuState state = cpu.getState();
        return new EmulatorStats(
            hostFrames,
            ppu.getFrameCount(),
            state.getExecuted(),
            state.getUnimplemented(),
            totalCycles,
            budgetCutFrames,
            dma.getTransfersCompleted(),
            bus.getRomLength(),
            runMillis
        );
    }
}

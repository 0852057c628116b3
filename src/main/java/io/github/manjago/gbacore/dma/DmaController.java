package io.github.manjago.gbacore.dma;

import io.github.manjago.gbacore.memory.AddressMap;
import io.github.manjago.gbacore.memory.Bus;
import io.github.manjago.gbacore.memory.IoRegisters;
import io.github.manjago.gbacore.memory.IoWriteObserver;
import io.github.manjago.gbacore.video.DisplayEventListener;
import io.github.manjago.gbacore.video.Ppu;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Four-channel DMA controller.
 * <p>
 * Writing a channel's CNT_H with the enable bit set latches source,
 * destination and count from the channel's register window. Immediate
 * channels then copy right away, inside the triggering write; V-blank and
 * H-blank channels wait for the matching {@link DisplayEventListener} event.
 * All reads and writes go through the {@link Bus}.
 */
public final class DmaController implements IoWriteObserver, DisplayEventListener {

    private static final Logger log = LoggerFactory.getLogger(DmaController.class);

    public static final int CHANNEL_COUNT = 4;

    private final Bus bus;
    private final IoRegisters io;
    private final DmaChannel[] channels = new DmaChannel[CHANNEL_COUNT];

    /** Channels triggered while another transfer was running */
    private final Deque<DmaChannel> pending = new ArrayDeque<>();
    private boolean transferring;

    private long transfersCompleted;

    public DmaController(Bus bus) {
        this.bus = bus;
        this.io = bus.getIo();
        for (int i = 0; i < CHANNEL_COUNT; i++) {
            channels[i] = new DmaChannel(i);
        }
    }

    public void reset() {
        for (DmaChannel channel : channels) {
            channel.disarm();
        }
        pending.clear();
        transferring = false;
        transfersCompleted = 0;
    }

    // ========== Triggers ==========

    @Override
    public void onIoWrite(int address, int value) {
        int offset = IoRegisters.offsetOf(address);
        for (DmaChannel channel : channels) {
            if (offset == channel.controlOffset()) {
                controlWritten(channel, value);
                return;
            }
        }
    }

    private void controlWritten(DmaChannel channel, int value) {
        if ((value & DmaChannel.ENABLE) == 0) {
            channel.disarm();
            return;
        }
        if (channel.isArmed()) {
            // Already enabled: only the control bits change
            channel.setControl(value);
            return;
        }
        channel.arm(value,
                bus.read32(AddressMap.IO_BASE + channel.sourceOffset()),
                bus.read32(AddressMap.IO_BASE + channel.destinationOffset()),
                bus.read16(AddressMap.IO_BASE + channel.countOffset()));

        if (channel.timing() == DmaChannel.Timing.IMMEDIATE) {
            start(channel);
        } else if (channel.timing() == DmaChannel.Timing.SPECIAL) {
            log.debug("DMA{} special timing not supported, channel stays idle", channel.getIndex());
        }
    }

    @Override
    public void onVBlank(long frame) {
        startTimed(DmaChannel.Timing.VBLANK);
    }

    @Override
    public void onHBlank(int scanline) {
        if (scanline < Ppu.VISIBLE_LINES) {
            startTimed(DmaChannel.Timing.HBLANK);
        }
    }

    private void startTimed(DmaChannel.Timing timing) {
        for (DmaChannel channel : channels) {
            if (channel.isArmed() && channel.timing() == timing) {
                start(channel);
            }
        }
    }

    /**
     * Run a channel now, or once the transfer in progress has finished.
     */
    private void start(DmaChannel channel) {
        if (transferring) {
            pending.addLast(channel);
            return;
        }
        transferring = true;
        try {
            transfer(channel);
            while (!pending.isEmpty()) {
                DmaChannel next = pending.pollFirst();
                if (next.isArmed()) {
                    transfer(next);
                }
            }
        } finally {
            transferring = false;
        }
    }

    // ========== Transfer ==========

    private void transfer(DmaChannel channel) {
        int unit = channel.unitSize();
        int sourceStep = channel.sourceControl().step(unit);
        int destinationStep = channel.destinationControl().step(unit);
        int source = channel.getSource() & -unit;
        int destination = channel.getDestination() & -unit;
        int count = channel.getCount();

        if (log.isDebugEnabled()) {
            log.debug("DMA{} {} x{} bytes 0x{} -> 0x{}", channel.getIndex(), count, unit,
                    Integer.toHexString(source), Integer.toHexString(destination));
        }

        for (int i = 0; i < count; i++) {
            if (unit == 4) {
                bus.write32(destination, bus.read32(source));
            } else {
                bus.write16(destination, bus.read16(source));
            }
            source += sourceStep;
            destination += destinationStep;
        }
        transfersCompleted++;

        channel.setSource(source);
        channel.setDestination(destination);
        finish(channel);
    }

    private void finish(DmaChannel channel) {
        if (channel.isRepeat() && channel.timing() != DmaChannel.Timing.IMMEDIATE) {
            channel.setCount(channel.unitsFor(io.get16(channel.countOffset())));
            if (channel.destinationControl() == DmaChannel.AddressControl.INCREMENT_RELOAD) {
                channel.setDestination(io.get32(channel.destinationOffset()));
            }
            return;
        }
        channel.disarm();
        io.set16(channel.controlOffset(), io.get16(channel.controlOffset()) & ~DmaChannel.ENABLE);
    }

    // ========== Getters ==========

    public DmaChannel getChannel(int index) {
        return channels[index];
    }

    public long getTransfersCompleted() {
        return transfersCompleted;
    }
}

package com.questrail.archon.protocol.model;

import java.util.List;
import java.util.Objects;

/**
 * FrameRingState
 * -----------------------------------------------------------------------------
 * Snapshot of the controller frame buffer ring produced by one FRAME query.
 *
 * @param timer        controller timer, 16 hex digits of 10 ns ticks
 * @param readBuffer   buffer currently locked for reading (1-based, 0 when none)
 * @param writeBuffer  buffer currently being written (1-based, 0 when none)
 * @param buffers      one descriptor per ring slot
 * @param newestIndex  0-based index of the newest complete buffer
 */
public record FrameRingState(
        String timer,
        int readBuffer,
        int writeBuffer,
        List<BufferDescriptor> buffers,
        int newestIndex
) {
    public FrameRingState {
        Objects.requireNonNull(timer, "timer");
        buffers = List.copyOf(Objects.requireNonNull(buffers, "buffers"));
        if (newestIndex < 0 || newestIndex >= buffers.size()) {
            throw new IllegalArgumentException("newestIndex " + newestIndex
                    + " outside ring of " + buffers.size());
        }
    }

    /**
     * The zeroed ring for a geometry: every descriptor empty, newest index 0.
     */
    public static FrameRingState initial(RingGeometry geometry) {
        BufferDescriptor[] descriptors = new BufferDescriptor[geometry.size()];
        for (int i = 0; i < descriptors.length; i++) {
            descriptors[i] = BufferDescriptor.empty(geometry.baseAddress(i));
        }
        return new FrameRingState("0000000000000000", 0, 0, List.of(descriptors), 0);
    }

    public int size() {
        return buffers.size();
    }

    public BufferDescriptor buffer(int index) {
        if (index < 0 || index >= buffers.size()) {
            throw new IndexOutOfBoundsException("buffer " + index + " outside ring of " + buffers.size());
        }
        return buffers.get(index);
    }

    public BufferDescriptor newest() {
        return buffers.get(newestIndex);
    }

    /**
     * Frame number of the newest buffer when it is complete, otherwise 0.
     */
    public int newestCompleteFrame() {
        BufferDescriptor newest = newest();
        return newest.complete() ? newest.frameNumber() : 0;
    }

    /**
     * Controller timer as an unsigned 64-bit tick count.
     */
    public long timerTicks() {
        return timer.isEmpty() ? 0L : Long.parseUnsignedLong(timer, 16);
    }
}

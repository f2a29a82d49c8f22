package com.questrail.archon.emulator;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.codec.NewestFrameSelector;
import com.questrail.archon.protocol.model.BufferDescriptor;
import com.questrail.archon.protocol.model.FrameRingState;
import com.questrail.archon.protocol.model.RingGeometry;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * EmulatedFrameRing
 * -----------------------------------------------------------------------------
 * The frame buffers of the emulated controller.
 *
 * <p>The ring has no geometry until a {@code BIGBUF} line is written; FRAME
 * queries and exposures fail until then. Writers (the sequencer thread and
 * configuration writes) and readers (FRAME, FETCH) synchronize on the ring.</p>
 */
public final class EmulatedFrameRing
{
    private RingGeometry geometry;
    private BufferDescriptor[] buffers = new BufferDescriptor[0];
    private int currentSlot;   // 1-based slot last written, 0 before the first frame
    private int frameCounter;
    private int readBuffer;
    private int newestIndex;

    /**
     * Sets the buffer count and base addresses. All descriptors are zeroed;
     * the global frame counter is kept.
     */
    public synchronized void configure(boolean bigBuffer) {
        geometry = RingGeometry.forBigBuffer(bigBuffer);
        buffers = new BufferDescriptor[geometry.size()];
        for (int i = 0; i < buffers.length; i++) {
            buffers[i] = BufferDescriptor.empty(geometry.baseAddress(i));
        }
        currentSlot = 0;
        readBuffer = 0;
        newestIndex = 0;
    }

    public synchronized boolean isConfigured() {
        return geometry != null;
    }

    public synchronized RingGeometry geometry() {
        return requireGeometry();
    }

    /**
     * Current ring state as a FRAME reply would report it.
     *
     * @param timer controller timer, 16 hex digits
     * @throws ArchonException.Validation when no {@code BIGBUF} line has been written
     */
    public synchronized FrameRingState snapshot(String timer) {
        requireGeometry();
        List<BufferDescriptor> list = List.of(buffers);
        newestIndex = NewestFrameSelector.select(list, newestIndex);
        return new FrameRingState(timer, readBuffer, currentSlot, list, newestIndex);
    }

    /**
     * Moves to the next slot, {@code slot = (slot mod N) + 1}, and marks it as being written.
     *
     * @return 0-based index of the slot
     */
    public synchronized int advance() {
        RingGeometry g = requireGeometry();
        currentSlot = (currentSlot % g.size()) + 1;
        int index = currentSlot - 1;
        g.checkIndex(index);
        return index;
    }

    public synchronized void beginReadout(int index, int width, int height, long timestamp) {
        BufferDescriptor b = buffer(index);
        buffers[index] = b.toBuilder()
                .complete(false)
                .width(width)
                .height(height)
                .pixelsProgress(0)
                .linesProgress(0)
                .timestamp(timestamp)
                .risingEdge(timestamp)
                .build();
    }

    public synchronized void progress(int index, int lines, int pixels) {
        buffers[index] = buffer(index).toBuilder()
                .linesProgress(lines)
                .pixelsProgress(pixels)
                .build();
    }

    /**
     * Marks a slot complete and stamps it with the next global frame number.
     *
     * @return the frame number recorded
     */
    public synchronized int complete(int index, long timestamp) {
        BufferDescriptor b = buffer(index);
        frameCounter++;
        buffers[index] = b.toBuilder()
                .complete(true)
                .frameNumber(frameCounter)
                .fallingEdge(timestamp)
                .build();
        return frameCounter;
    }

    /**
     * @throws ArchonException.Validation when the index is outside the ring
     */
    public synchronized BufferDescriptor buffer(int index) {
        requireGeometry().checkIndex(index);
        return buffers[index];
    }

    /**
     * Buffer whose base address equals {@code address}.
     */
    public synchronized Optional<BufferDescriptor> bufferAt(long address) {
        return Arrays.stream(buffers).filter(b -> b.baseAddress() == address).findFirst();
    }

    /**
     * Records a {@code LOCKn} request; 0 unlocks.
     */
    public synchronized void lock(int bufferNumber) {
        if (bufferNumber != 0) {
            requireGeometry().checkIndex(bufferNumber - 1);
        }
        readBuffer = bufferNumber;
    }

    public synchronized int frameCounter() {
        return frameCounter;
    }

    private RingGeometry requireGeometry() {
        if (geometry == null) {
            throw new ArchonException.Validation("frame buffers undefined, load a configuration containing BIGBUF");
        }
        return geometry;
    }
}

package com.questrail.archon.client;

import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.ArchonCommandEncoder;
import com.questrail.archon.protocol.codec.FrameStatusCodec;
import com.questrail.archon.protocol.model.FrameRingState;
import com.questrail.archon.protocol.model.RingGeometry;

import java.util.Objects;

/**
 * FrameRing
 * -----------------------------------------------------------------------------
 * Host view of the controller's frame buffer ring.
 *
 * <p>Every {@link #refreshStatus()} replaces the whole snapshot. The ring
 * starts with three buffers and is resized when a configuration is loaded;
 * resizing zeroes every descriptor.</p>
 */
public final class FrameRing
{
    private final ArchonCommandChannel channel;

    private volatile RingGeometry geometry = RingGeometry.forBigBuffer(false);
    private volatile FrameRingState state = FrameRingState.initial(geometry);

    public FrameRing(ArchonCommandChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Sends FRAME and replaces the snapshot.
     *
     * <p>The newest index carries over from the previous snapshot, so a buffer
     * is only preferred when its frame number is strictly greater. On failure the
     * previous snapshot is kept.</p>
     */
    public synchronized FrameRingState refreshStatus() {
        String payload = channel.send(ArchonVerbs.FRAME);
        FrameRingState next = FrameStatusCodec.decode(payload, geometry, state.newestIndex());
        state = next;
        return next;
    }

    /**
     * Locks a buffer for reading with {@code LOCKn}.
     *
     * @param index 0-based buffer index
     */
    public void lockBuffer(int index) {
        geometry.checkIndex(index);
        channel.send(ArchonCommandEncoder.lock(index + 1));
    }

    public void unlock() {
        channel.send(ArchonVerbs.UNLOCK);
    }

    /**
     * Switches to the two-buffer layout when {@code bigBuffer} is set, three buffers otherwise.
     */
    public synchronized void resize(boolean bigBuffer) {
        RingGeometry next = RingGeometry.forBigBuffer(bigBuffer);
        geometry = next;
        state = FrameRingState.initial(next);
    }

    public RingGeometry geometry() {
        return geometry;
    }

    public FrameRingState state() {
        return state;
    }
}

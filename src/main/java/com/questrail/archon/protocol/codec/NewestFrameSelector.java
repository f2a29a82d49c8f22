package com.questrail.archon.protocol.codec;

import com.questrail.archon.protocol.model.BufferDescriptor;

import java.util.List;

/**
 * Picks the buffer holding the newest complete frame.
 *
 * <p>The candidate starts at the previously selected index. A descriptor
 * replaces it only when its frame number is strictly greater and it is
 * complete, so on equal frame numbers the earlier candidate stays. When every
 * frame number is 0 (cold start) the result is 0.</p>
 */
public final class NewestFrameSelector
{
    private NewestFrameSelector() {}

    /**
     * @param buffers      descriptors of the whole ring
     * @param currentIndex previously selected index; values outside the ring restart from 0
     * @return 0-based index of the newest complete buffer
     */
    public static int select(List<BufferDescriptor> buffers, int currentIndex) {
        if (buffers.isEmpty()) {
            throw new IllegalArgumentException("ring has no buffers");
        }

        boolean allZero = true;
        for (BufferDescriptor b : buffers) {
            if (b.frameNumber() != 0) {
                allZero = false;
                break;
            }
        }
        if (allZero) {
            return 0;
        }

        int candidate = (currentIndex >= 0 && currentIndex < buffers.size()) ? currentIndex : 0;
        int newestFrame = buffers.get(candidate).frameNumber();

        for (int i = 0; i < buffers.size(); i++) {
            BufferDescriptor b = buffers.get(i);
            if (b.frameNumber() > newestFrame && b.complete()) {
                newestFrame = b.frameNumber();
                candidate = i;
            }
        }
        return candidate;
    }
}

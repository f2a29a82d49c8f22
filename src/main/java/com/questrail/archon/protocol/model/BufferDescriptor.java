package com.questrail.archon.protocol.model;

import java.util.Objects;

/**
 * BufferDescriptor
 * -----------------------------------------------------------------------------
 * Reported state of one controller frame buffer, as carried by the
 * {@code BUFn*} keys of a FRAME reply.
 *
 * <p>Descriptors are immutable snapshots. A status query replaces every
 * descriptor of the ring at once; there is no partial update.</p>
 *
 * @param sampleMode      16 or 32 bit samples
 * @param complete        buffer holds a fully read-out frame
 * @param mode            top, bottom or split readout
 * @param baseAddress     controller memory address used by FETCH
 * @param frameNumber     frame counter value recorded when the buffer completed
 * @param width           pixels per line
 * @param height          lines
 * @param pixelsProgress  pixel progress within the current line
 * @param linesProgress   line progress of the readout
 * @param rawBlocks       raw blocks per line
 * @param rawLines        raw lines
 * @param rawOffset       raw data offset
 * @param timestamp       controller timer at readout start
 * @param risingEdge      timer at the trigger rising edge
 * @param fallingEdge     timer at the trigger falling edge
 */
public record BufferDescriptor(
        SampleMode sampleMode,
        boolean complete,
        BufferMode mode,
        long baseAddress,
        int frameNumber,
        int width,
        int height,
        int pixelsProgress,
        int linesProgress,
        int rawBlocks,
        int rawLines,
        int rawOffset,
        long timestamp,
        long risingEdge,
        long fallingEdge
) {
    public BufferDescriptor {
        Objects.requireNonNull(sampleMode, "sampleMode");
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * A zeroed descriptor, the state of every slot after a ring resize.
     */
    public static BufferDescriptor empty(long baseAddress) {
        return builder().baseAddress(baseAddress).build();
    }

    /**
     * Bytes occupied by the image in this buffer.
     */
    public long imageBytes() {
        return (long) width * height * sampleMode.bytesPerSample();
    }

    public Builder toBuilder() {
        return new Builder()
                .sampleMode(sampleMode)
                .complete(complete)
                .mode(mode)
                .baseAddress(baseAddress)
                .frameNumber(frameNumber)
                .width(width)
                .height(height)
                .pixelsProgress(pixelsProgress)
                .linesProgress(linesProgress)
                .rawBlocks(rawBlocks)
                .rawLines(rawLines)
                .rawOffset(rawOffset)
                .timestamp(timestamp)
                .risingEdge(risingEdge)
                .fallingEdge(fallingEdge);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SampleMode sampleMode = SampleMode.BITS_16;
        private boolean complete;
        private BufferMode mode = BufferMode.TOP;
        private long baseAddress;
        private int frameNumber;
        private int width;
        private int height;
        private int pixelsProgress;
        private int linesProgress;
        private int rawBlocks;
        private int rawLines;
        private int rawOffset;
        private long timestamp;
        private long risingEdge;
        private long fallingEdge;

        public Builder sampleMode(SampleMode sampleMode) {
            this.sampleMode = sampleMode;
            return this;
        }

        public Builder complete(boolean complete) {
            this.complete = complete;
            return this;
        }

        public Builder mode(BufferMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder baseAddress(long baseAddress) {
            this.baseAddress = baseAddress;
            return this;
        }

        public Builder frameNumber(int frameNumber) {
            this.frameNumber = frameNumber;
            return this;
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder height(int height) {
            this.height = height;
            return this;
        }

        public Builder pixelsProgress(int pixelsProgress) {
            this.pixelsProgress = pixelsProgress;
            return this;
        }

        public Builder linesProgress(int linesProgress) {
            this.linesProgress = linesProgress;
            return this;
        }

        public Builder rawBlocks(int rawBlocks) {
            this.rawBlocks = rawBlocks;
            return this;
        }

        public Builder rawLines(int rawLines) {
            this.rawLines = rawLines;
            return this;
        }

        public Builder rawOffset(int rawOffset) {
            this.rawOffset = rawOffset;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder risingEdge(long risingEdge) {
            this.risingEdge = risingEdge;
            return this;
        }

        public Builder fallingEdge(long fallingEdge) {
            this.fallingEdge = fallingEdge;
            return this;
        }

        public BufferDescriptor build() {
            return new BufferDescriptor(sampleMode, complete, mode, baseAddress, frameNumber,
                    width, height, pixelsProgress, linesProgress, rawBlocks, rawLines, rawOffset,
                    timestamp, risingEdge, fallingEdge);
        }
    }
}

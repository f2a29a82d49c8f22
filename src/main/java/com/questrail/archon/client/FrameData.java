package com.questrail.archon.client;

import com.questrail.archon.protocol.model.SampleMode;

import java.util.Objects;

/**
 * One image read out of a controller frame buffer.
 *
 * @param frameNumber global frame number reported for the buffer
 * @param bufferIndex 0-based ring slot the image came from
 * @param width       pixels per line
 * @param height      lines
 * @param sampleMode  bytes per pixel
 * @param pixels      raw pixel bytes, little-endian, exactly {@code width * height * bytesPerSample} long
 */
public record FrameData(
        int frameNumber,
        int bufferIndex,
        int width,
        int height,
        SampleMode sampleMode,
        byte[] pixels
) {
    public FrameData {
        Objects.requireNonNull(sampleMode, "sampleMode");
        Objects.requireNonNull(pixels, "pixels");
    }

    /**
     * Unsigned 16-bit sample at a pixel position. Only meaningful for {@link SampleMode#BITS_16}.
     */
    public int sample16(int x, int y) {
        int i = (y * width + x) * 2;
        return (pixels[i] & 0xFF) | (pixels[i + 1] & 0xFF) << 8;
    }
}

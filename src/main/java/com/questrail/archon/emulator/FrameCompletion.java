package com.questrail.archon.emulator;

import com.questrail.archon.protocol.model.BufferDescriptor;

/**
 * Published by the {@link ExposureSequencer} each time a frame buffer completes.
 *
 * @param frameNumber global frame number written into the buffer
 * @param bufferIndex 0-based ring slot
 * @param buffer      descriptor as it stood on completion
 */
public record FrameCompletion(int frameNumber, int bufferIndex, BufferDescriptor buffer)
{
}

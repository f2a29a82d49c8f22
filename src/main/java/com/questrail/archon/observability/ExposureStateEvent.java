package com.questrail.archon.observability;

import java.time.Instant;

/**
 * Record representing an exposure sequencer transition or a completed frame.
 *
 * @param frameNumber global frame number for {@code FRAME_COMPLETE}, otherwise the last completed frame
 * @param bufferIndex 0-based ring slot involved, or -1 when none
 */
public record ExposureStateEvent(
    Instant timestamp,
    Kind kind,
    int frameNumber,
    int bufferIndex
) {
    public enum Kind {
        STARTED,
        FRAME_COMPLETE,
        FINISHED,
        ABORTED
    }
}

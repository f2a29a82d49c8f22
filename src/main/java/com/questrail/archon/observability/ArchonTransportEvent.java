package com.questrail.archon.observability;

import java.time.Instant;

/**
 * Record representing a connection-level event.
 */
public record ArchonTransportEvent(
    Instant timestamp,
    Kind kind,
    String peer
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        LISTENING,
        CLIENT_ACCEPTED,
        CLIENT_CLOSED
    }
}

package com.questrail.archon.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the Archon protocol stack.
 */
public record ArchonErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.archon.observability;

import java.time.Instant;

/**
 * One command exchange as seen by the command channel or the emulator dispatcher.
 *
 * @param timestamp wall-clock time of completion
 * @param refId     reference id the command was sent with, as two hex digits
 * @param command   command text without framing
 * @param reply     reply payload, or the failure message when {@code success} is false
 * @param success   whether the exchange produced a valid reply
 * @param quiet     whether the verb is polled at high frequency
 */
public record ArchonCommandEvent(
    Instant timestamp,
    String refId,
    String command,
    String reply,
    boolean success,
    boolean quiet
) {
}
